package com.openforge.connectors.credential;

import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Optional;

/**
 * Interactive prompt on a console-like stream pair.
 *
 * Disabled unless explicitly allowed, and even then only consulted for
 * credentials declared {@link CredentialSpec#promptable() promptable}.
 */
@Slf4j
public class PromptCredentialProvider implements CredentialProvider {

    private final boolean allowed;
    private final BufferedReader in;
    private final PrintStream out;

    public PromptCredentialProvider(boolean allowed, BufferedReader in, PrintStream out) {
        this.allowed = allowed;
        this.in = in;
        this.out = out;
    }

    @Override
    public CredentialOrigin origin() {
        return CredentialOrigin.PROMPT;
    }

    @Override
    public String describe(CredentialSpec spec) {
        return allowed && spec.promptable() ? "prompt" : "prompt(disabled)";
    }

    @Override
    public Optional<String> lookup(CredentialSpec spec) {
        if (!allowed || !spec.promptable()) {
            return Optional.empty();
        }
        synchronized (this) {
            out.printf("Enter value for %s (%s): ", spec.name(), spec.envVar());
            out.flush();
            try {
                return Optional.ofNullable(in.readLine());
            } catch (IOException e) {
                log.warn("[Credentials] Prompt for '{}' failed: {}", spec.name(), e.getMessage());
                return Optional.empty();
            }
        }
    }
}
