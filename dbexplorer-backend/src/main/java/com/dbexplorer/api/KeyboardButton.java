package com.dbexplorer.api;

import lombok.Value;

/**
 * Inline button. Pressing it sends {@code callbackData} back as the next envelope's command.
 */
@Value
public class KeyboardButton {
    String text;
    String callbackData;
}
