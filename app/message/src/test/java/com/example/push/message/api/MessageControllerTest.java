/*
 * どこで: Message API の Web 層テスト
 * 何を: エンドポイントの入出力と例外マッピングを検証する
 * なぜ: ページング URL やエラー応答の形を固定するため
 */
package com.example.push.message.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.push.message.api.request.CreateMessageRequest;
import com.example.push.message.api.request.PagingRequest;
import com.example.push.message.model.MessageRecord;
import com.example.push.message.model.PagingResult;
import com.example.push.message.service.MessageLifecycleService;
import com.example.push.message.service.MessageQueryService;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest({MessageController.class, StatusController.class})
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class MessageControllerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-03-01T09:00:00Z");

  @Autowired private MockMvc mockMvc;

  @MockitoBean private MessageQueryService queryService;
  @MockitoBean private MessageLifecycleService lifecycleService;

  @Test
  void statusReturnsOk() throws Exception {
    mockMvc
        .perform(get("/"))
        .andExpect(status().isOk())
        .andExpect(content().string("message: ok"))
        .andExpect(header().doesNotExist("X-Request-Id"));
  }

  @Test
  void apiResponsesEchoRequestId() throws Exception {
    mockMvc
        .perform(delete("/message").header("X-User-Id", "1").header("X-Request-Id", "req-9"))
        .andExpect(status().isOk())
        .andExpect(header().string("X-Request-Id", "req-9"));
  }

  @Test
  void getMessagesReturnsPageWithNextUrl() throws Exception {
    when(queryService.listForUser(eq(1L), any(PagingRequest.class)))
        .thenReturn(PagingResult.withNext(List.of(message(10L), message(9L)), 2, 9L));

    mockMvc
        .perform(get("/message").param("limit", "2").header("X-User-Id", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.messages.length()").value(2))
        .andExpect(jsonPath("$.messages[0].id").value(10))
        .andExpect(jsonPath("$.messages[0].appid").value(5))
        .andExpect(jsonPath("$.messages[0].title").value("title-10"))
        .andExpect(jsonPath("$.messages[0].date").value("2026-03-01T09:00:00Z"))
        .andExpect(jsonPath("$.paging.size").value(2))
        .andExpect(jsonPath("$.paging.limit").value(2))
        .andExpect(jsonPath("$.paging.since").value(9))
        .andExpect(jsonPath("$.paging.next").value("http://localhost/message?limit=2&since=9"));
  }

  @Test
  void getMessagesOmitsNextOnLastPage() throws Exception {
    when(queryService.listForUser(eq(1L), any(PagingRequest.class)))
        .thenReturn(PagingResult.lastPage(List.of(message(8L)), 2));

    mockMvc
        .perform(get("/message").param("limit", "2").param("since", "9").header("X-User-Id", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.paging.since").value(0))
        .andExpect(jsonPath("$.paging.next").doesNotExist())
        .andExpect(jsonPath("$.messages[0].priority").doesNotExist());
  }

  @Test
  void getMessagesUsesDefaultPaging() throws Exception {
    when(queryService.listForUser(eq(1L), any(PagingRequest.class)))
        .thenReturn(PagingResult.lastPage(List.of(), PagingRequest.DEFAULT_LIMIT));

    mockMvc.perform(get("/message").header("X-User-Id", "1")).andExpect(status().isOk());

    final ArgumentCaptor<PagingRequest> captor = ArgumentCaptor.forClass(PagingRequest.class);
    verify(queryService).listForUser(eq(1L), captor.capture());
    assertThat(captor.getValue()).isEqualTo(PagingRequest.firstPage());
  }

  @Test
  void getApplicationMessagesKeepsPathInNextUrl() throws Exception {
    when(queryService.listForApplication(eq(1L), eq(5L), any(PagingRequest.class)))
        .thenReturn(PagingResult.withNext(List.of(message(10L)), 1, 10L));

    mockMvc
        .perform(
            get("/application/5/message")
                .param("limit", "1")
                .param("since", "50")
                .header("X-User-Id", "1"))
        .andExpect(status().isOk())
        .andExpect(
            jsonPath("$.paging.next")
                .value("http://localhost/application/5/message?limit=1&since=10"));
  }

  @Test
  void getMessagesRejectsLimitOutOfRange() throws Exception {
    mockMvc
        .perform(get("/message").param("limit", "0").header("X-User-Id", "1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("limit must be between 1 and 200"));

    mockMvc
        .perform(get("/message").param("limit", "201").header("X-User-Id", "1"))
        .andExpect(status().isBadRequest());

    verifyNoInteractions(queryService);
  }

  @Test
  void getMessagesRejectsNegativeSince() throws Exception {
    mockMvc
        .perform(get("/message").param("since", "-1").header("X-User-Id", "1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("since must not be negative"));
  }

  @Test
  void getMessagesRejectsNonNumericLimit() throws Exception {
    mockMvc
        .perform(get("/message").param("limit", "many").header("X-User-Id", "1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("limit must be a number"));
  }

  @Test
  void getMessagesRequiresUserHeader() throws Exception {
    mockMvc
        .perform(get("/message"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("X-User-Id is required"));
  }

  @Test
  void getApplicationMessagesReturns404ForForeignApplication() throws Exception {
    when(queryService.listForApplication(eq(2L), eq(5L), any(PagingRequest.class)))
        .thenThrow(new ApplicationNotFoundException(5L));

    mockMvc
        .perform(get("/application/5/message").header("X-User-Id", "2"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("NOT_FOUND"))
        .andExpect(jsonPath("$.message").value("application does not exist"));
  }

  @Test
  void getMessagesReturns500OnStorageFailure() throws Exception {
    when(queryService.listForUser(eq(1L), any(PagingRequest.class)))
        .thenThrow(new DataAccessResourceFailureException("connection refused"));

    mockMvc
        .perform(get("/message").header("X-User-Id", "1"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("STORAGE_ERROR"))
        .andExpect(jsonPath("$.message").value("message storage failure"));
  }

  @Test
  void deleteMessagesDelegatesToLifecycle() throws Exception {
    mockMvc.perform(delete("/message").header("X-User-Id", "1")).andExpect(status().isOk());

    verify(lifecycleService).deleteAllForUser(1L);
  }

  @Test
  void deleteApplicationMessagesDelegatesToLifecycle() throws Exception {
    mockMvc
        .perform(delete("/application/5/message").header("X-User-Id", "1"))
        .andExpect(status().isOk());

    verify(lifecycleService).deleteAllForApplication(1L, 5L);
  }

  @Test
  void deleteMessageReturns404WhenMissing() throws Exception {
    doThrow(new MessageNotFoundException(99L)).when(lifecycleService).deleteMessage(1L, 99L);

    mockMvc
        .perform(delete("/message/99").header("X-User-Id", "1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("message does not exist"));
  }

  @Test
  void deleteMessageRejectsNonNumericId() throws Exception {
    mockMvc
        .perform(delete("/message/abc").header("X-User-Id", "1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

    verify(lifecycleService, never()).deleteMessage(anyLong(), anyLong());
  }

  @Test
  void createMessageUsesHeaderToken() throws Exception {
    when(lifecycleService.create(eq("AbCdEf123"), any(CreateMessageRequest.class)))
        .thenReturn(
            new MessageRecord(
                11L, 5L, "Weather Bot", "rain at noon", 5, Map.of("k", "v"), FIXED_NOW));

    mockMvc
        .perform(
            post("/message")
                .header("X-Application-Token", "AbCdEf123")
                .param("token", "ignored")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"message":"rain at noon","priority":5,"extras":{"k":"v"}}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(11))
        .andExpect(jsonPath("$.appid").value(5))
        .andExpect(jsonPath("$.title").value("Weather Bot"))
        .andExpect(jsonPath("$.priority").value(5))
        .andExpect(jsonPath("$.extras.k").value("v"));
  }

  @Test
  void createMessageFallsBackToQueryToken() throws Exception {
    when(lifecycleService.create(eq("query-token"), any(CreateMessageRequest.class)))
        .thenReturn(new MessageRecord(12L, 5L, "t", "body", null, null, FIXED_NOW));

    mockMvc
        .perform(
            post("/message")
                .param("token", "query-token")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"t","message":"body"}
                    """))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.id").value(12));
  }

  @Test
  void createMessageReturns401ForInvalidToken() throws Exception {
    when(lifecycleService.create(any(), any(CreateMessageRequest.class)))
        .thenThrow(new InvalidApplicationTokenException());

    mockMvc
        .perform(
            post("/message")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"message":"body"}
                    """))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
  }

  @Test
  void createMessageRejectsBlankBody() throws Exception {
    mockMvc
        .perform(
            post("/message")
                .header("X-Application-Token", "AbCdEf123")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"title":"t","message":" "}
                    """))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));

    verifyNoInteractions(lifecycleService);
  }

  @Test
  void createMessageRejectsMalformedJson() throws Exception {
    mockMvc
        .perform(
            post("/message")
                .header("X-Application-Token", "AbCdEf123")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"message\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("request body is invalid"));
  }

  @Test
  void resolveTokenPrefersHeaderAndFallsBackOnBlank() {
    assertThat(MessageController.resolveToken("header", "query")).isEqualTo("header");
    assertThat(MessageController.resolveToken(" ", "query")).isEqualTo("query");
    assertThat(MessageController.resolveToken(null, null)).isNull();
  }

  private static MessageRecord message(long id) {
    return new MessageRecord(id, 5L, "title-" + id, "body-" + id, null, null, FIXED_NOW);
  }
}
