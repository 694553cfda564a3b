package com.zenithionpay.merchantbot.polling;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zenithionpay.merchantbot.model.ChatEvent;
import com.zenithionpay.merchantbot.model.ChatEventKind;
import java.io.IOException;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TelegramUpdateParserTest {

  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void command_isNormalized() throws IOException {
    ChatEvent event =
        parse(
                "{\"update_id\":1,\"message\":{\"message_id\":7,\"chat\":{\"id\":-100},"
                    + "\"from\":{\"id\":555},\"text\":\"/Start@ZenithionBot now\"}}")
            .orElseThrow();

    assertThat(event.kind()).isEqualTo(ChatEventKind.COMMAND);
    assertThat(event.payload()).isEqualTo("/start");
    assertThat(event.chatId()).isEqualTo("-100");
    assertThat(event.userId()).isEqualTo("555");
    assertThat(event.messageId()).isEqualTo("7");
    assertThat(event.conversationKey()).isEqualTo("555|-100");
  }

  @Test
  void plainText_isText() throws IOException {
    ChatEvent event =
        parse(
                "{\"update_id\":2,\"message\":{\"message_id\":8,\"chat\":{\"id\":1},"
                    + "\"from\":{\"id\":2},\"text\":\" p-1 \"}}")
            .orElseThrow();

    assertThat(event.kind()).isEqualTo(ChatEventKind.TEXT);
    assertThat(event.payload()).isEqualTo(" p-1 ");
  }

  @Test
  void messageWithoutText_isTextWithEmptyPayload() throws IOException {
    ChatEvent event =
        parse(
                "{\"update_id\":3,\"message\":{\"message_id\":9,\"chat\":{\"id\":1},"
                    + "\"from\":{\"id\":2},\"sticker\":{\"file_id\":\"x\"}}}")
            .orElseThrow();

    assertThat(event.kind()).isEqualTo(ChatEventKind.TEXT);
    assertThat(event.payload()).isEmpty();
  }

  @Test
  void callback_carriesQueryIdAndSourceMessage() throws IOException {
    ChatEvent event =
        parse(
                "{\"update_id\":4,\"callback_query\":{\"id\":\"cb-1\",\"from\":{\"id\":2},"
                    + "\"data\":\"balance\",\"message\":{\"message_id\":11,\"chat\":{\"id\":1}}}}")
            .orElseThrow();

    assertThat(event.kind()).isEqualTo(ChatEventKind.CALLBACK);
    assertThat(event.payload()).isEqualTo("balance");
    assertThat(event.callbackQueryId()).isEqualTo("cb-1");
    assertThat(event.messageId()).isEqualTo("11");
  }

  @Test
  void unsupportedUpdates_areSkipped() throws IOException {
    assertThat(parse("{\"update_id\":5,\"edited_message\":{\"text\":\"x\"}}")).isEmpty();
    assertThat(
            parse(
                "{\"update_id\":6,\"callback_query\":{\"id\":\"cb\",\"from\":{\"id\":2},"
                    + "\"data\":\"balance\"}}"))
        .isEmpty();
    assertThat(TelegramUpdateParser.parse(null)).isEmpty();
  }

  private Optional<ChatEvent> parse(String json) throws IOException {
    JsonNode node = mapper.readTree(json);
    return TelegramUpdateParser.parse(node);
  }
}
