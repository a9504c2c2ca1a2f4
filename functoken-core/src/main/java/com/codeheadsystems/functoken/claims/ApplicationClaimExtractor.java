package com.codeheadsystems.functoken.claims;

import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.functoken.exceptions.ClaimsInvalidException;
import com.codeheadsystems.functoken.model.ApplicationClaim;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.type.LogicalType;
import java.io.IOException;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the {@code application_claim} array out of a verified token.
 * <p>
 * The payload is decoded once, straight into a typed view; other claims are ignored. A missing
 * or {@code null} array counts as empty. An empty array, a {@code null} entry, or any entry that
 * is not an object of string fields makes the claims invalid. Only the first entry is returned.
 */
public class ApplicationClaimExtractor {

  /**
   * Name of the custom claim holding the application scopes.
   */
  public static final String APPLICATION_CLAIM = "application_claim";

  private static final Logger log = LoggerFactory.getLogger(ApplicationClaimExtractor.class);
  private static final Base64.Decoder B64URL = Base64.getUrlDecoder();

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new extractor with a strict mapper.
   */
  public ApplicationClaimExtractor() {
    this(strictMapper());
  }

  /**
   * Instantiates a new extractor.
   *
   * @param objectMapper mapper used to decode the token payload
   */
  public ApplicationClaimExtractor(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Mapper that ignores unknown claims but refuses to turn numbers, booleans or empty strings
   * into the string and list fields of the payload.
   *
   * @return the object mapper
   */
  public static ObjectMapper strictMapper() {
    ObjectMapper mapper = JsonMapper.builder()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();
    mapper.coercionConfigFor(LogicalType.Textual)
        .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
        .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
    mapper.coercionConfigFor(LogicalType.Collection)
        .setCoercion(CoercionInputShape.EmptyString, CoercionAction.Fail);
    return mapper;
  }

  /**
   * Extracts the application claim to evaluate.
   *
   * @param token a token whose signature has already been verified
   * @return the first application claim
   * @throws ClaimsInvalidException if the claim array is absent, empty or malformed
   */
  public ApplicationClaim extract(DecodedJWT token) {
    List<ApplicationClaim> claims = decode(token).applicationClaims();
    if (claims == null || claims.isEmpty()) {
      log.debug("Token carries no {} entries", APPLICATION_CLAIM);
      throw new ClaimsInvalidException();
    }
    ApplicationClaim first = claims.get(0);
    if (first == null) {
      log.debug("First {} entry is null", APPLICATION_CLAIM);
      throw new ClaimsInvalidException();
    }
    if (claims.size() > 1) {
      log.debug("Token carries {} {} entries; only the first is evaluated", claims.size(), APPLICATION_CLAIM);
    }
    return first;
  }

  private TokenPayload decode(DecodedJWT token) {
    try {
      byte[] payload = B64URL.decode(token.getPayload());
      return objectMapper.readValue(payload, TokenPayload.class);
    } catch (IOException | IllegalArgumentException e) {
      log.debug("Token {} could not be decoded: {}", APPLICATION_CLAIM, e.getMessage());
      throw new ClaimsInvalidException();
    }
  }

  /**
   * The part of the token payload this library reads.
   *
   * @param applicationClaims the application scopes, null when the claim is absent
   */
  @JsonIgnoreProperties(ignoreUnknown = true)
  record TokenPayload(@JsonProperty(APPLICATION_CLAIM) List<ApplicationClaim> applicationClaims) {
  }
}
