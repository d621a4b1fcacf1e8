package com.example.push.message.api.response;

import com.fasterxml.jackson.annotation.JsonInclude;

/** next は次ページが無い場合は出力しない。 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PagingResponse(int size, int limit, long since, String next) {}
