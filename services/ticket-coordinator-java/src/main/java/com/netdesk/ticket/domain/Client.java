package com.netdesk.ticket.domain;

import java.util.UUID;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Read-only view of a customer record. Client management lives in the back office;
 * tickets only need the name and the chat contact.
 */
@Table("clients")
public class Client {

    @Id
    private UUID id;

    private String name;

    @Column("telegram_contact")
    private String telegramContact;

    public Client() {
    }

    public Client(UUID id, String name, String telegramContact) {
        this.id = id;
        this.name = name;
        this.telegramContact = telegramContact;
    }

    public UUID getId() {
        return id;
    }

    public void setId(UUID id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTelegramContact() {
        return telegramContact;
    }

    public void setTelegramContact(String telegramContact) {
        this.telegramContact = telegramContact;
    }
}
