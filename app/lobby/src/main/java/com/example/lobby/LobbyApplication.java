/*
 * どこで: Lobby アプリのエントリポイント
 * 何を: Spring Boot の起動と設定スキャン/スケジューラ有効化を行う
 * なぜ: カタログ/ルーム/起動/評価の API と掃除ワーカーを単一アプリとして起動するため
 */
package com.example.lobby;

import java.time.Clock;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Bean;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@ConfigurationPropertiesScan
public class LobbyApplication {

  public static void main(String[] args) {
    SpringApplication.run(LobbyApplication.class, args);
  }

  /** ルームの作成/起動/終了と評価の時刻は UTC で揃える。テストでは固定 Clock を直接渡す。 */
  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }
}
