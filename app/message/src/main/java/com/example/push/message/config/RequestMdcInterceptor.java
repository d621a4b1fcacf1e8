/*
 * どこで: Message Web 設定
 * 何を: リクエスト単位の運用キーを MDC へ出し入れし、request_id を応答ヘッダへ返す
 * なぜ: JSON ログで操作ユーザと API 種別ごとに追跡し、クライアント側ログと突き合わせるため
 */
package com.example.push.message.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;
import org.springframework.web.servlet.HandlerMapping;

@Component
public class RequestMdcInterceptor implements HandlerInterceptor {

  static final String HEADER_REQUEST_ID = "X-Request-Id";
  static final String HEADER_USER_ID = "X-User-Id";

  static final String MDC_REQUEST_ID = "request_id";
  static final String MDC_HTTP_METHOD = "http_method";
  static final String MDC_HTTP_PATH = "http_path";
  static final String MDC_HTTP_ROUTE = "http_route";
  static final String MDC_CLIENT_IP = "client_ip";
  static final String MDC_USER_ID = "user_id";

  private static final String ATTRIBUTE_KEYS = RequestMdcInterceptor.class.getName() + ".MDC_KEYS";

  @Override
  public boolean preHandle(
      HttpServletRequest request, HttpServletResponse response, Object handler) {
    final List<String> keys = new ArrayList<>();
    final String requestId = resolveRequestId(request);
    put(keys, MDC_REQUEST_ID, requestId);
    put(keys, MDC_HTTP_METHOD, request.getMethod());
    put(keys, MDC_HTTP_PATH, request.getRequestURI());
    put(keys, MDC_HTTP_ROUTE, resolveRoute(request));
    // X-Forwarded-For は server.forward-headers-strategy=framework で remoteAddr に反映済み
    put(keys, MDC_CLIENT_IP, request.getRemoteAddr());
    put(keys, MDC_USER_ID, request.getHeader(HEADER_USER_ID));
    request.setAttribute(ATTRIBUTE_KEYS, keys);
    response.setHeader(HEADER_REQUEST_ID, requestId);
    return true;
  }

  @Override
  public void afterCompletion(
      HttpServletRequest request,
      HttpServletResponse response,
      Object handler,
      @Nullable Exception ex) {
    if (!(request.getAttribute(ATTRIBUTE_KEYS) instanceof List<?> rawKeys)) {
      return;
    }
    for (Object rawKey : rawKeys) {
      if (rawKey instanceof String key) {
        MDC.remove(key);
      }
    }
  }

  private String resolveRequestId(HttpServletRequest request) {
    final String requestId = request.getHeader(HEADER_REQUEST_ID);
    if (requestId != null && !requestId.isBlank()) {
      return requestId;
    }
    return UUID.randomUUID().toString();
  }

  /** /application/{id}/message のようなパターン。ID を含まないため集計キーに使える。 */
  private String resolveRoute(HttpServletRequest request) {
    final Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
    return pattern == null ? null : pattern.toString();
  }

  private void put(List<String> keys, String key, String value) {
    if (value == null || value.isBlank()) {
      return;
    }
    MDC.put(key, value);
    keys.add(key);
  }
}
