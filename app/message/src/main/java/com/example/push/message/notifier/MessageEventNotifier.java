/*
 * どこで: Message 通知層
 * 何を: ライブリスナーへのイベント配信を抽象化する
 * なぜ: 配信経路 (NATS/ログ/テスト用) をライフサイクル処理から差し替え可能にするため
 */
package com.example.push.message.notifier;

import com.example.push.message.model.MessageEvent;

public interface MessageEventNotifier {

  /**
   * 役割: userId に紐づく全ライブリスナーへ event を届ける。 動作: ベストエフォート。失敗時は RuntimeException を送出してよいが、呼び出し側は伝播させない。
   * 前提: 並行呼び出しに対してスレッドセーフであること。
   */
  void notifyUser(long userId, MessageEvent event);
}
