package com.splitttr.editor;

import io.smallrye.jwt.build.Jwt;

// Signs bearer tokens with the test key (smallrye.jwt.sign.key.location).
public final class TokenUtils {

  private TokenUtils() {}

  public static String token(String subject, String name) {
    return Jwt.issuer("https://splitttr.example")
        .subject(subject)
        .claim("name", name)
        .expiresIn(3600)
        .sign();
  }
}
