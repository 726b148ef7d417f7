package com.whereq.memori.notification.content;

import com.whereq.memori.notification.NotificationKind;

/**
 * Typed payload of a notification. Each implementation matches exactly one
 * {@link NotificationKind}.
 */
public interface NotificationContent {

    NotificationKind getKind();
}
