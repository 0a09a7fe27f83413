package com.example.fundraisingdashboard.interpreter;

import com.example.fundraisingdashboard.model.Command;

import java.util.Optional;

/**
 * Turns free text into a structured command. Text that is not a data operation yields empty.
 */
public interface CommandInterpreter {

    Optional<Command> parse(String text);
}
