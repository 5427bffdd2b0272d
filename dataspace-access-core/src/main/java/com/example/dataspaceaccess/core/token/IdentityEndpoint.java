package com.example.dataspaceaccess.core.token;

/** Remote identity service issuing and accepting access tokens. */
public interface IdentityEndpoint {

  /**
   * Performs a password grant.
   *
   * @param login account login
   * @param secret account password
   * @param otp one-time code, or null
   * @return the granted token
   * @throws AuthRejectedException if the credentials are refused
   * @throws NetworkException if the endpoint cannot be reached or answers unexpectedly
   */
  TokenGrant requestGrant(final String login, final String secret, final String otp);

  /**
   * Checks whether the endpoint still accepts an access token.
   *
   * @param accessToken token to check
   * @return probe verdict; never throws for transport failures
   */
  ProbeResult probe(final String accessToken);
}
