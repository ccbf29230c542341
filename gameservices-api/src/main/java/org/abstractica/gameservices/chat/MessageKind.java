package org.abstractica.gameservices.chat;

/**
 * Kind of a chat message.
 */
public sealed interface MessageKind
{
    /**
     * Plain room message.
     */
    record Normal() implements MessageKind {}

    /**
     * Emote, shown as an action of the sender.
     */
    record Emote() implements MessageKind {}

    /**
     * Private message to a single player.
     *
     * @param targetId the recipient's player id
     */
    record Whisper(long targetId) implements MessageKind {}
}
