package com.ludo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the Ludo game server.
 *
 * Features:
 * - Server-authoritative rules and dice
 * - Multiplayer support via STOMP over WebSockets
 * - Game state kept in Redis with an idle expiry
 */
@SpringBootApplication
public class LudoGameApplication {

    public static void main(String[] args) {
        SpringApplication.run(LudoGameApplication.class, args);
    }
}
