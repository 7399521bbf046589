package com.agentswarm.common.handoff;

import com.agentswarm.common.model.HandoffDeclaration;

import java.util.Optional;

/**
 * Outcome of scanning one agent output for a handoff declaration.
 *
 * <ul>
 *   <li>{@link Status#OK}        – a well-formed declaration; {@code declaration} is set.</li>
 *   <li>{@link Status#MALFORMED} – a header was found but no block was usable; {@code detail} says why.</li>
 *   <li>{@link Status#ABSENT}    – no header token in the output.</li>
 * </ul>
 *
 * <p>Both non-OK states mean "no handoff": the output is final.
 */
public record ParseResult(
    Status             status,
    HandoffDeclaration declaration,
    String             detail
) {

    public enum Status {
        OK,
        MALFORMED,
        ABSENT
    }

    private static final ParseResult ABSENT = new ParseResult(Status.ABSENT, null, "no handoff header");

    public static ParseResult ok(HandoffDeclaration declaration) {
        return new ParseResult(Status.OK, declaration, null);
    }

    public static ParseResult malformed(String detail) {
        return new ParseResult(Status.MALFORMED, null, detail);
    }

    public static ParseResult absent() {
        return ABSENT;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Optional<HandoffDeclaration> asOptional() {
        return Optional.ofNullable(declaration);
    }
}
