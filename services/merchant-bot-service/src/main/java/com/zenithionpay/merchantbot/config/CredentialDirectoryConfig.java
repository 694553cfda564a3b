package com.zenithionpay.merchantbot.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zenithionpay.merchantbot.domain.CredentialDirectory;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Loads the operator enrollment file: a JSON object of {@code credential -> [identity, ...]}.
 *
 * <p>The bot still starts when the file is missing or broken; every operator is then refused until
 * the file is fixed and the service restarted.
 */
@Configuration
@Slf4j
public class CredentialDirectoryConfig {

  @Bean
  public CredentialDirectory credentialDirectory(
      ObjectMapper mapper,
      @Value("${merchant.credentials.file:api_tokens.json}") String credentialsFile) {
    return load(mapper, Path.of(credentialsFile));
  }

  public static CredentialDirectory load(ObjectMapper mapper, Path file) {
    if (!Files.isRegularFile(file)) {
      log.warn("Credentials file {} not found; no operator is authorized", file.toAbsolutePath());
      return CredentialDirectory.empty();
    }

    JsonNode root;
    try {
      root = mapper.readTree(file.toFile());
    } catch (IOException e) {
      log.warn("Failed to read credentials file {}: {}", file.toAbsolutePath(), e.getMessage());
      return CredentialDirectory.empty();
    }
    if (root == null || !root.isObject()) {
      log.warn("Credentials file {} must hold a JSON object", file.toAbsolutePath());
      return CredentialDirectory.empty();
    }

    Map<String, List<String>> enrollments = new LinkedHashMap<>();
    root.fields()
        .forEachRemaining(
            entry -> {
              JsonNode ids = entry.getValue();
              if (!ids.isArray()) {
                log.warn("Skipping credential entry with non-array value");
                return;
              }
              List<String> identities = new ArrayList<>();
              for (JsonNode id : ids) {
                if (id.isTextual() || id.isNumber()) {
                  identities.add(id.asText());
                }
              }
              enrollments.put(entry.getKey(), identities);
            });

    CredentialDirectory directory = CredentialDirectory.of(enrollments);
    log.info("Loaded {} merchant credentials from {}", directory.credentialCount(), file);
    return directory;
  }
}
