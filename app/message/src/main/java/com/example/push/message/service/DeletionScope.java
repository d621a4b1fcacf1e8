package com.example.push.message.service;

/** 削除操作の対象範囲。メトリクスのタグとログに使う。 */
public enum DeletionScope {
  MESSAGE("message"),
  APPLICATION("application"),
  USER("user");

  private final String value;

  DeletionScope(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }
}
