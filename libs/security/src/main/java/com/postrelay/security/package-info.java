/**
 * Caller identity for the PostRelay platform.
 *
 * <p>{@link com.postrelay.security.Credential} is the value; {@link
 * com.postrelay.security.CredentialContext} is the per-request slot through which library code
 * finds it without receiving it as a parameter.
 */
package com.postrelay.security;
