package com.example.push.message.service;

import com.example.push.message.model.MessageRecord;
import java.util.List;

/** ID 降順で since 未満のメッセージを最大 limit 件取得するクエリ。since=0 は上限なし。 */
@FunctionalInterface
public interface MessagePageQuery {
  List<MessageRecord> fetch(int limit, long since);
}
