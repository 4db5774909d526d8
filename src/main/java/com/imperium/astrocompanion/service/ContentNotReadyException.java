package com.imperium.astrocompanion.service;

/**
 * 用户尚未完成首次生成（没有星盘或内容包），不能执行依赖内容包的操作。
 */
public class ContentNotReadyException extends RuntimeException {

    public ContentNotReadyException(String userId) {
        super("Profile " + userId + " has no generated content yet, complete onboarding first");
    }
}
