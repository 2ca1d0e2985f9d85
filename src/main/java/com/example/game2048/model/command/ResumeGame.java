package com.example.game2048.model.command;

public record ResumeGame(String slotId) implements Command {
}
