/*
 * どこで: Lobby Web 設定
 * 何を: RequestMdcInterceptor を /v1 配下の API へ適用する
 * なぜ: ルーム/ゲーム単位のログ相関キーを API ログへ埋め込むため (actuator は対象外)
 */
package com.example.lobby.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns("/v1/**");
  }
}
