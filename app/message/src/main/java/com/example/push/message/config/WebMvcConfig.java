/*
 * どこで: Message Web 設定
 * 何を: RequestMdcInterceptor をメッセージ API へ適用する
 * なぜ: API ログへ運用キーを埋め込み、ロードバランサの疎通確認はログ対象から外すため
 */
package com.example.push.message.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private static final String STATUS_PATH = "/";

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry
        .addInterceptor(requestMdcInterceptor)
        .addPathPatterns("/**")
        .excludePathPatterns(STATUS_PATH);
  }
}
