package com.zenithionpay.merchantbot.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * @param timeout default upper bound for one call
 * @param infoTimeout shorter bound for the merchant summary lookup
 * @param tlsVerify when false the server certificate chain and host name are not checked; only
 *     for private deployments with self-signed certificates
 */
@Validated
@ConfigurationProperties(prefix = "merchant.api")
public record MerchantApiProperties(
    @NotBlank String baseUrl,
    @NotNull Duration timeout,
    @NotNull Duration infoTimeout,
    boolean tlsVerify) {}
