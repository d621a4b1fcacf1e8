/*
 * どこで: Message サービス層
 * 何を: limit/since からページを組み立て、次ページのカーソルを算出する
 * なぜ: COUNT クエリなしで次ページの有無を判定し、ページングをステートレスに保つため
 */
package com.example.push.message.service;

import com.example.push.message.api.request.PagingRequest;
import com.example.push.message.model.MessageRecord;
import com.example.push.message.model.PagingResult;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class MessagePagingService {

  /**
   * 役割: 1 ページ分のメッセージを取得する。 動作: limit+1 件を先読みし、limit を超えた場合のみ先頭 limit 件に切り詰め、最後に残した行の ID を次カーソルとする。
   * 前提: paging は検証済みであること。
   */
  public PagingResult buildPage(PagingRequest paging, MessagePageQuery query) {
    final int limit = paging.limit();
    // +1 件は次ページの有無を判定するための先読み行で、応答には含めない
    final List<MessageRecord> fetched = query.fetch(limit + 1, paging.since());
    if (fetched.size() <= limit) {
      return PagingResult.lastPage(fetched, limit);
    }
    final List<MessageRecord> page = fetched.subList(0, limit);
    final long nextSince = page.get(page.size() - 1).id();
    return PagingResult.withNext(page, limit, nextSince);
  }
}
