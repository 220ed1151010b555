/*
 * どこで: API クライアント設定
 * 何を: 認証系エンドポイントのパスを保持する
 * なぜ: トークン再取得の対象外にする公開エンドポイントを明示するため
 */
package com.finly.api_client.config;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finly.api.auth")
public record AuthEndpointProperties(
    String loginPath,
    String signupPath,
    String verifyEmailPath,
    String resendVerificationPath,
    String forgotPasswordPath,
    String resetPasswordPath,
    String refreshTokenPath,
    String logoutPath,
    String currentUserPath,
    List<String> publicPaths) {

  private static final List<String> DEFAULT_PUBLIC_PATHS =
      List.of(
          "auth/login",
          "auth/signup",
          "auth/refresh-token",
          "auth/verify-email",
          "auth/resend-verification",
          "auth/forgot-password",
          "auth/reset-password");

  public AuthEndpointProperties {
    loginPath = isBlank(loginPath) ? "auth/login" : loginPath;
    signupPath = isBlank(signupPath) ? "auth/signup" : signupPath;
    verifyEmailPath = isBlank(verifyEmailPath) ? "auth/verify-email" : verifyEmailPath;
    resendVerificationPath =
        isBlank(resendVerificationPath) ? "auth/resend-verification" : resendVerificationPath;
    forgotPasswordPath = isBlank(forgotPasswordPath) ? "auth/forgot-password" : forgotPasswordPath;
    resetPasswordPath = isBlank(resetPasswordPath) ? "auth/reset-password" : resetPasswordPath;
    refreshTokenPath = isBlank(refreshTokenPath) ? "auth/refresh-token" : refreshTokenPath;
    logoutPath = isBlank(logoutPath) ? "auth/logout" : logoutPath;
    currentUserPath = isBlank(currentUserPath) ? "auth/me" : currentUserPath;
    publicPaths =
        publicPaths == null || publicPaths.isEmpty()
            ? DEFAULT_PUBLIC_PATHS
            : List.copyOf(publicPaths);
  }

  public static AuthEndpointProperties defaults() {
    return new AuthEndpointProperties(null, null, null, null, null, null, null, null, null, null);
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
