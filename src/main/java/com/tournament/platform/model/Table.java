package com.tournament.platform.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Table {
    public static final int SEATS = 4;
    
    private String id;
    private int tableNumber;
    @Builder.Default
    private List<String> players = new ArrayList<>();
    @Builder.Default
    private Map<String, Position> positions = new LinkedHashMap<>();
    private Instant createdAt;
}
