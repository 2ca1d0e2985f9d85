package com.example.game2048.exception;

public class SlotOccupiedException extends Game2048Exception {

    public SlotOccupiedException(String slotId) {
        super("Slot " + slotId + " is already occupied");
    }
}
