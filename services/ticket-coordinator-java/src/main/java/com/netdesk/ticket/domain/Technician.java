package com.netdesk.ticket.domain;

import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Read-only view of a back-office user acting as a technician.
 */
@Table("users")
public class Technician {

    @Id
    private UUID id;

    private String username;

    @Column("telegram_chat_id")
    private String telegramChatId;

    public Technician() {
    }

    public Technician(UUID id, String username, String telegramChatId) {
        this.id = id;
        this.username = username;
        this.telegramChatId = telegramChatId;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getTelegramChatId() {
        return telegramChatId;
    }

    public void setTelegramChatId(String telegramChatId) {
        this.telegramChatId = telegramChatId;
    }
}
