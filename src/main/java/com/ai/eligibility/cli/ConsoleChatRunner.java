package com.ai.eligibility.cli;

import com.ai.eligibility.service.ConversationOrchestrator;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

/**
 * Interactive chat on stdin/stdout, enabled with {@code chat.console.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "chat.console.enabled", havingValue = "true")
public class ConsoleChatRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ConsoleChatRunner.class);

    private static final Set<String> EXIT_WORDS = Set.of("salir", "exit", "quit");
    private static final String RULE = "=".repeat(60);

    private final ConversationOrchestrator orchestrator;

    public ConsoleChatRunner(ConversationOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run(String... args) throws IOException {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        chat(in, System.out);
    }

    void chat(BufferedReader in, PrintStream out) throws IOException {
        out.println(RULE);
        out.println("Chatbot de Elegibilidad - KoolKars");
        out.println(RULE);
        out.println();
        out.println("Escribe 'salir' o 'exit' para terminar la conversación.");
        out.println();

        String conversationId = UUID.randomUUID().toString();
        boolean firstTurn = true;
        out.println("Conversación iniciada. Escribe 'Hola' para comenzar.");
        out.println();

        while (true) {
            out.print("Usuario: ");
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                out.println("¡Hasta luego!");
                return;
            }
            String input = line.trim();
            if (input.isEmpty()) {
                continue;
            }
            if (EXIT_WORDS.contains(input.toLowerCase(Locale.ROOT))) {
                out.println();
                out.println("¡Hasta luego!");
                return;
            }

            ConversationOrchestrator.TurnResult result;
            try {
                result = orchestrator.processMessage(conversationId, input);
            } catch (RuntimeException e) {
                if (firstTurn && e instanceof DataAccessException) {
                    log.error("Conversation storage is not reachable", e);
                    out.println("Error: no se pudo acceder al almacenamiento de conversaciones (" + e.getMessage() + ")");
                    return;
                }
                log.warn("Turn failed: {}", e.getMessage());
                out.println();
                out.println("Error: " + e.getMessage());
                out.println("Por favor, intenta de nuevo.");
                out.println();
                continue;
            }
            firstTurn = false;

            if (StringUtils.isNotEmpty(result.getResponse())) {
                out.println("Chatbot: " + result.getResponse());
                out.println();
            }
            if (result.isCompleted()) {
                out.println();
                out.println(RULE);
                out.println("Conversación finalizada. Gracias por usar nuestro servicio.");
                out.println(RULE);
                return;
            }
        }
    }
}
