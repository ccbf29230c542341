package org.abstractica.gameservices.chat;

import org.abstractica.gameservices.PlayerInfo;

import java.util.Objects;

/**
 * An immutable chat message.
 *
 * <p>The sender is captured when the message is sent and is not linked to
 * the live player afterwards.</p>
 *
 * @param sender          sender snapshot
 * @param content         message text
 * @param timestampMillis send time in epoch milliseconds
 * @param kind            message kind
 */
public record ChatMessage(PlayerInfo sender, String content, long timestampMillis, MessageKind kind)
{
    public ChatMessage
    {
        Objects.requireNonNull(sender, "sender");
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(kind, "kind");
    }
}
