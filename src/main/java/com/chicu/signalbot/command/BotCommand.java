package com.chicu.signalbot.command;

import java.util.List;

public interface BotCommand {

    /** Без префикса, регистр не важен: "purge", "crypto", "AD". */
    String name();

    String help();

    void execute(List<String> args, CommandContext ctx);
}
