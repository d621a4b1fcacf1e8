/*
 * どこで: Message Repository 層
 * 何を: メッセージ/アプリケーションの永続化操作を抽象化する
 * なぜ: ストレージ実装 (Postgres/インメモリ) をサービス層から切り離すため
 */
package com.example.push.message.repository;

import com.example.push.message.model.ApplicationRecord;
import com.example.push.message.model.MessageRecord;
import com.example.push.message.model.NewMessage;
import java.util.List;
import java.util.Optional;

/**
 * メッセージストアの契約。
 *
 * <p>未検出は空の {@link Optional} / 空リストで返す。I/O や制約違反は {@link
 * org.springframework.dao.DataAccessException} 系で送出する。実装はスレッドセーフであること。
 */
public interface MessageRepository {

  /** 役割: アプリケーション配下の全メッセージを返す。 動作: ID 降順。 */
  List<MessageRecord> findByApplication(long applicationId);

  /** 役割: ユーザが所有する全アプリケーションのメッセージを返す。 動作: ID 降順。 */
  List<MessageRecord> findByUser(long userId);

  /**
   * 役割: アプリケーション配下のメッセージを最大 limit 件返す。 動作: since が 0 なら最新から、0 より大きければ ID &lt; since
   * の範囲を ID 降順で返す。
   */
  List<MessageRecord> findByApplicationSince(long applicationId, int limit, long since);

  /** 役割: ユーザ配下のメッセージを最大 limit 件返す。 動作: 条件と順序は findByApplicationSince と同じ。 */
  List<MessageRecord> findByUserSince(long userId, int limit, long since);

  Optional<MessageRecord> findMessageById(long messageId);

  Optional<ApplicationRecord> findApplicationById(long applicationId);

  Optional<ApplicationRecord> findApplicationByToken(String token);

  void deleteMessageById(long messageId);

  void deleteByApplication(long applicationId);

  void deleteByUser(long userId);

  /** 役割: メッセージを保存する。 動作: ID はストア側で単調増加に採番し、採番済みレコードを返す。 */
  MessageRecord create(NewMessage message);
}
