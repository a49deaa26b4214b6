package org.querylex.cli;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

public class CommandLineInterfaceTest {

    @Test
    public void testCliInitialization() {
        CommandLine cmd = CommandLineInterface.createCommandLine();
        assertEquals("querylex", cmd.getCommandName());
        assertNotNull(cmd.getSubcommands().get("tokenize"));
    }
}
