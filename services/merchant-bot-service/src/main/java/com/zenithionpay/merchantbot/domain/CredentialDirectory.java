package com.zenithionpay.merchantbot.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Maps chat identities to merchant API credentials and back.
 *
 * <p>Built once at startup and never mutated, so reads need no locking. An identity belongs to at
 * most one credential; a credential may be shared by several identities, which are also the
 * recipients of its deposit notifications.
 */
@Slf4j
public final class CredentialDirectory {

  private final Map<String, List<String>> identitiesByCredential;
  private final Map<String, String> credentialByIdentity;

  private CredentialDirectory(
      Map<String, List<String>> identitiesByCredential, Map<String, String> credentialByIdentity) {
    this.identitiesByCredential = identitiesByCredential;
    this.credentialByIdentity = credentialByIdentity;
  }

  public static CredentialDirectory empty() {
    return new CredentialDirectory(Map.of(), Map.of());
  }

  /**
   * @param enrollments credential to enrolled identities, in the order they should be notified.
   *     Iteration order decides which credential wins for an identity listed more than once.
   */
  public static CredentialDirectory of(Map<String, List<String>> enrollments) {
    Map<String, List<String>> forward = new LinkedHashMap<>();
    Map<String, String> reverse = new HashMap<>();
    if (enrollments != null) {
      enrollments.forEach(
          (credential, identities) -> {
            if (credential == null || credential.isBlank()) {
              return;
            }
            List<String> ids = new ArrayList<>();
            if (identities != null) {
              for (String id : identities) {
                if (id == null || id.isBlank()) continue;
                String identity = id.trim();
                if (ids.contains(identity)) continue;
                ids.add(identity);
                String previous = reverse.putIfAbsent(identity, credential);
                if (previous != null && !previous.equals(credential)) {
                  log.warn(
                      "Identity {} is enrolled under several credentials; keeping {}",
                      identity,
                      mask(previous));
                }
              }
            }
            forward.put(credential, Collections.unmodifiableList(ids));
          });
    }
    return new CredentialDirectory(
        Collections.unmodifiableMap(forward), Collections.unmodifiableMap(reverse));
  }

  public Optional<String> credentialFor(String identity) {
    if (identity == null || identity.isBlank()) {
      return Optional.empty();
    }
    return Optional.ofNullable(credentialByIdentity.get(identity.trim()));
  }

  public List<String> identitiesFor(String credential) {
    if (credential == null) {
      return List.of();
    }
    return identitiesByCredential.getOrDefault(credential, List.of());
  }

  public int credentialCount() {
    return identitiesByCredential.size();
  }

  /** Log-safe form of a credential: only the last four characters are kept. */
  public static String mask(String credential) {
    if (credential == null || credential.isEmpty()) {
      return "<none>";
    }
    if (credential.length() <= 4) {
      return "****";
    }
    return "****" + credential.substring(credential.length() - 4);
  }
}
