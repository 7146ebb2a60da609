package com.example.automation.service;

/**
 * 对一次投递的认领凭证：认领时写入的 version。持有过期凭证的任务不会再发送。
 */
public record DeliveryClaim(String deliveryId, long version) {
}
