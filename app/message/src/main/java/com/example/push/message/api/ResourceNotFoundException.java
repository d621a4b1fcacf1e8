/*
 * どこで: Message API
 * 何を: 参照先が存在しない、または操作ユーザの所有でないことを表現する
 * なぜ: 非所有と不存在を同じ 404 に揃え、存在の有無を漏らさないため
 */
package com.example.push.message.api;

public abstract class ResourceNotFoundException extends RuntimeException {

  private final long resourceId;

  protected ResourceNotFoundException(String message, long resourceId) {
    super(message);
    this.resourceId = resourceId;
  }

  public long resourceId() {
    return resourceId;
  }
}
