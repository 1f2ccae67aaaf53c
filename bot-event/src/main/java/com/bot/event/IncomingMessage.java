package com.bot.event;

import java.util.Objects;

/**
 * A chat message as seen by the dispatcher: who sent it, where, the raw text, and the
 * permission group the sender holds.
 */
public final class IncomingMessage {

    private final String senderId;
    private final String groupId;
    private final String rawMessage;
    private final PermissionGroup senderPermission;

    private IncomingMessage(Builder b) {
        this.senderId = b.senderId;
        this.groupId = b.groupId;
        this.rawMessage = b.rawMessage != null ? b.rawMessage : "";
        this.senderPermission = b.senderPermission != null ? b.senderPermission : PermissionGroup.USER;
    }

    /** Private message with the given raw text and sender permission. */
    public static IncomingMessage of(String rawMessage, PermissionGroup senderPermission) {
        return builder().rawMessage(rawMessage).senderPermission(senderPermission).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getSenderId() {
        return senderId;
    }

    /** Group the message was posted in; null for a private message. */
    public String getGroupId() {
        return groupId;
    }

    public boolean isGroupMessage() {
        return groupId != null;
    }

    /** Raw message text, never null. */
    public String getRawMessage() {
        return rawMessage;
    }

    public PermissionGroup getSenderPermission() {
        return senderPermission;
    }

    @Override
    public String toString() {
        return "IncomingMessage{sender=" + senderId + ", group=" + groupId + ", permission=" + senderPermission
                + ", raw='" + rawMessage + "'}";
    }

    public static final class Builder {
        private String senderId;
        private String groupId;
        private String rawMessage;
        private PermissionGroup senderPermission = PermissionGroup.USER;

        public Builder senderId(String senderId) {
            this.senderId = senderId;
            return this;
        }

        public Builder groupId(String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder rawMessage(String rawMessage) {
            this.rawMessage = rawMessage;
            return this;
        }

        public Builder senderPermission(PermissionGroup senderPermission) {
            this.senderPermission = Objects.requireNonNull(senderPermission, "senderPermission");
            return this;
        }

        public IncomingMessage build() {
            return new IncomingMessage(this);
        }
    }
}
