package com.codeheadsystems.portal.server.auth;

import com.codeheadsystems.portal.model.auth.TokenResponse;
import java.net.URI;

/**
 * The OIDC identity provider as the portal uses it.
 */
public interface IdentityProviderAccessor extends KeySetSource {

  /**
   * The provider's authorization endpoint.
   *
   * @return the endpoint
   */
  URI authorizationEndpoint();

  /**
   * Exchanges an authorization code for tokens.
   *
   * @param code         the code
   * @param redirectUri  the redirect URI used in the authorization request
   * @param codeVerifier the PKCE verifier
   * @return the tokens
   */
  TokenResponse exchangeCode(String code, String redirectUri, String codeVerifier);

  /**
   * Ends the provider session the refresh token belongs to.
   *
   * @param refreshToken the refresh token
   */
  void endSession(String refreshToken);
}
