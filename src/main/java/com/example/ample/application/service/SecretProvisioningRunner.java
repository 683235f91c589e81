package com.example.ample.application.service;

import com.example.ample.common.exception.ErrorKind;
import com.example.ample.common.exception.ScrobblerException;
import com.example.ample.infrastructure.secret.SecretStore;
import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Handles {@code --password}/{@code -p} and {@code --secret}/{@code -s}: prompts for each requested
 * value and stores it. Active only under the {@code provision} profile, where the sampling loop is
 * not started.
 */
@Component
@Profile("provision")
public class SecretProvisioningRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(SecretProvisioningRunner.class);

    static final String CODE_PROMPT_FAILED = "SECRET_PROMPT_FAILED";

    private static final Set<String> PASSWORD_FLAGS = new LinkedHashSet<>(Arrays.asList("--password", "-p"));
    private static final Set<String> SECRET_FLAGS = new LinkedHashSet<>(Arrays.asList("--secret", "-s"));

    private final SecretStore secretStore;
    private final SecretPrompt prompt;

    @Autowired
    public SecretProvisioningRunner(SecretStore secretStore) {
        this(secretStore, SecretProvisioningRunner::readFromConsole);
    }

    SecretProvisioningRunner(SecretStore secretStore, SecretPrompt prompt) {
        this.secretStore = secretStore;
        this.prompt = prompt;
    }

    public static boolean isProvisioningArgument(String arg) {
        return PASSWORD_FLAGS.contains(arg) || SECRET_FLAGS.contains(arg);
    }

    @Override
    public void run(ApplicationArguments args) {
        provision(args.getSourceArgs());
    }

    /**
     * @return number of secrets stored
     */
    int provision(String... args) {
        boolean wantPassword = false;
        boolean wantSecret = false;
        for (String arg : args) {
            if (PASSWORD_FLAGS.contains(arg)) {
                wantPassword = true;
            } else if (SECRET_FLAGS.contains(arg)) {
                wantSecret = true;
            } else {
                log.warn("Unknown argument ignored, arg={}", arg);
            }
        }

        int stored = 0;
        if (wantPassword && store(SecretStore.PASSWORD_ENTRY, "LastFM password: ")) {
            stored++;
        }
        if (wantSecret && store(SecretStore.API_SECRET_ENTRY, "LastFM API secret: ")) {
            stored++;
        }
        return stored;
    }

    private boolean store(String entryName, String label) {
        String value = prompt.read(label);
        if (!StringUtils.hasText(value)) {
            log.warn("Empty value, nothing stored, entry={}", entryName);
            return false;
        }
        secretStore.set(entryName, value.trim());
        log.info("Secret stored, entry={}", entryName);
        return true;
    }

    private static String readFromConsole(String label) {
        Console console = System.console();
        if (console != null) {
            char[] chars = console.readPassword("%s", label);
            return chars == null ? null : new String(chars);
        }
        System.out.print(label);
        System.out.flush();
        try {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            return reader.readLine();
        } catch (IOException e) {
            throw new ScrobblerException(ErrorKind.CONFIGURATION, CODE_PROMPT_FAILED,
                    "Reading secret from stdin failed", e);
        }
    }

    @FunctionalInterface
    interface SecretPrompt {

        String read(String label);
    }
}
