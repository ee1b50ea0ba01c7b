package com.pluginroute.hooks;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pluginroute.intercept.InterceptMatch;
import com.pluginroute.intercept.InterceptMessageBuilder;
import com.pluginroute.intercept.InterceptResolver;
import com.pluginroute.intercept.QualifiedNames;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

/**
 * Post-tool-use hook for Skill invocations.
 *
 * <p>
 * Reads the hook payload from stdin and, when the invoked skill is a command
 * some MCP server intercepts, prints {@code {"systemMessage": "..."}} to stdout.
 * Every other case exits quietly with status 0 so the host carries on as usual.
 *
 * <pre>
 * {"tool_name": "Skill", "tool_input": {"skill": "legal:review-contract"}}
 * </pre>
 */
@Slf4j
public class SkillInterceptHook {

    static final String SKILL_TOOL = "Skill";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final InterceptResolver resolver;

    public SkillInterceptHook(InterceptResolver resolver) {
        this.resolver = resolver;
    }

    public static void main(String[] args) {
        int status = new SkillInterceptHook(new InterceptResolver()).run(System.in, System.out);
        System.exit(status);
    }

    /**
     * Handle one hook payload.
     *
     * @return process exit status
     */
    public int run(InputStream in, PrintStream out) {
        String raw;
        try {
            raw = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Cannot read hook input: {}", e.getMessage());
            return 0;
        }

        Optional<String> skillName = skillName(raw);
        if (skillName.isEmpty())
            return 0;

        Optional<InterceptMatch> match = resolver.findIntercept(skillName.get());
        if (match.isEmpty())
            return 0;

        try {
            out.println(MAPPER.writeValueAsString(
                    Map.of("systemMessage", InterceptMessageBuilder.build(match.get()))));
            out.flush();
        } catch (JsonProcessingException e) {
            log.error("Cannot encode system message for {}", skillName.get(), e);
            return 1;
        }
        log.debug("Intercepted {} via {}", skillName.get(), match.get().toolName());
        return 0;
    }

    /**
     * Qualified skill name of a Skill tool payload; empty for other tools,
     * invalid JSON, or unqualified names.
     */
    static Optional<String> skillName(String raw) {
        JsonNode input;
        try {
            input = MAPPER.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("Ignoring invalid hook input: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (input == null || !input.isObject())
            return Optional.empty();
        if (!SKILL_TOOL.equals(input.path("tool_name").asText(null)))
            return Optional.empty();

        JsonNode skill = input.path("tool_input").path("skill");
        if (!skill.isTextual())
            return Optional.empty();
        String name = skill.asText();
        return QualifiedNames.isQualified(name) ? Optional.of(name) : Optional.empty();
    }
}
