package com.copyleft.Coup.domain.view;

import java.util.List;

public record PlayerView(
        String id,
        String name,
        int coins,
        boolean alive,
        List<CardView> influence
) {}
