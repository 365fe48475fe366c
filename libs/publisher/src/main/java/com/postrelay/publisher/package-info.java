/**
 * The publisher daemon: a background loop that runs the scheduling library's publish cycle with an
 * identity taken from the token store instead of an inbound request.
 */
package com.postrelay.publisher;
