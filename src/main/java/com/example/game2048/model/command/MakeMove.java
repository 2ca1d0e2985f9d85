package com.example.game2048.model.command;

import com.example.game2048.model.domain.Direction;

public record MakeMove(String gameUuid, Direction direction) implements Command {
}
