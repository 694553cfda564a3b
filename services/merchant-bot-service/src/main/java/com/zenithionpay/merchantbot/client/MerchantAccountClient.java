package com.zenithionpay.merchantbot.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.zenithionpay.merchantbot.config.MerchantApiProperties;
import java.util.Map;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

/** Merchant account endpoints used by the bot. */
@Service
public class MerchantAccountClient {

  private final MerchantApiClient api;
  private final MerchantApiProperties properties;

  public MerchantAccountClient(MerchantApiClient api, MerchantApiProperties properties) {
    this.api = api;
    this.properties = properties;
  }

  public JsonNode merchantInfo(String credential) {
    return api.get("merchant/info", credential, null, properties.infoTimeout());
  }

  public JsonNode paymentsHistory(String credential, int limit, boolean withClosed) {
    MultiValueMap<String, String> query = new LinkedMultiValueMap<>();
    query.add("limit", Integer.toString(limit));
    query.add("with_closed", withClosed ? "true" : "false");
    return api.get("payments/history", credential, query);
  }

  /** @param idOrAddress payment id or the TRON address issued for the payment */
  public JsonNode payment(String credential, String idOrAddress) {
    return api.get("payments/{id}", Map.of("id", idOrAddress), credential);
  }

  public WithdrawalOutcome withdraw(String credential, String toAddress) {
    JsonNode payload =
        api.post("merchant/balance/withdraw", credential, Map.of("to_address", toAddress));
    return WithdrawalOutcome.fromPayload(payload);
  }
}
