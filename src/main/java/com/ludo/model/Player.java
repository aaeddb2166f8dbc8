package com.ludo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A connected player. The color stays {@code null} until chosen.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Player {

    private String sessionId;

    private Color color;
}
