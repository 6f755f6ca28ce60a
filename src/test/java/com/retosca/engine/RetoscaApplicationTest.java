package com.retosca.engine;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class RetoscaApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void testReverseSubcommandIsRegistered() {
        assertThat(RetoscaApplication.commandLine().getSubcommands()).containsKey("reverse");
    }

    @Test
    void testUnknownOptionExitsWithFailure() {
        int exitCode = RetoscaApplication.commandLine().execute("reverse", "--no-such-option");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testReverseThroughTopLevelCommand() throws IOException {
        Path plan = tempDir.resolve("plan.json");
        Files.writeString(plan, TestPlans.read("module-plan.json"));
        Path output = tempDir.resolve("module.yaml");

        int exitCode = RetoscaApplication.commandLine()
                .execute("reverse", "-p", plan.toString(), "-o", output.toString(), "-a", "platform");

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output))
                .contains("module_network_aws_vpc_this:")
                .contains("template_author: platform");
    }
}
