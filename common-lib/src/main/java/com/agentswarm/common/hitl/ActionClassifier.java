package com.agentswarm.common.hitl;

import com.agentswarm.common.model.ActionCategory;
import com.agentswarm.common.model.PendingAction;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Maps an action type to its risk category.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>exact match in the known-type table</li>
 *   <li>the always-pause list, which is {@link ActionCategory#CRITICAL}</li>
 *   <li>keyword heuristics on whole tokens of the type, most severe category first</li>
 *   <li>{@link ActionCategory#MODERATE}</li>
 * </ol>
 */
public final class ActionClassifier {

    public static final Set<String> ALWAYS_PAUSE = Set.of(
        "git_push_force",
        "database_drop",
        "rm_rf",
        "format_disk",
        "delete_branch_main",
        "delete_branch_master"
    );

    private static final Map<String, ActionCategory> KNOWN_TYPES = Map.ofEntries(
        Map.entry("file_read",      ActionCategory.SAFE),
        Map.entry("list_files",     ActionCategory.SAFE),
        Map.entry("search",         ActionCategory.SAFE),
        Map.entry("query",          ActionCategory.SAFE),
        Map.entry("get",            ActionCategory.SAFE),
        Map.entry("file_write",     ActionCategory.MODERATE),
        Map.entry("file_create",    ActionCategory.MODERATE),
        Map.entry("update",         ActionCategory.MODERATE),
        Map.entry("insert",         ActionCategory.MODERATE),
        Map.entry("git_commit",     ActionCategory.MODERATE),
        Map.entry("git_push",       ActionCategory.MODERATE),
        Map.entry("file_delete",    ActionCategory.DESTRUCTIVE),
        Map.entry("delete",         ActionCategory.DESTRUCTIVE),
        Map.entry("remove",         ActionCategory.DESTRUCTIVE),
        Map.entry("git_reset",      ActionCategory.DESTRUCTIVE),
        Map.entry("git_push_force", ActionCategory.CRITICAL),
        Map.entry("database_drop",  ActionCategory.CRITICAL),
        Map.entry("truncate",       ActionCategory.CRITICAL),
        Map.entry("format",         ActionCategory.CRITICAL)
    );

    // Checked in order; the first category with a matching keyword wins. A keyword matches
    // whole tokens, so "enforced" never matches "force"; "rm_rf" needs the adjacent tokens rm, rf.
    private static final List<Map.Entry<ActionCategory, List<String>>> KEYWORDS = List.of(
        Map.entry(ActionCategory.CRITICAL,    List.of("force", "truncate", "reset_hard", "rm_rf")),
        Map.entry(ActionCategory.DESTRUCTIVE, List.of("delete", "remove", "drop")),
        Map.entry(ActionCategory.MODERATE,    List.of("write", "create", "update", "insert")),
        Map.entry(ActionCategory.SAFE,        List.of("read", "get", "list", "search", "query"))
    );

    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^a-z0-9]+");

    private ActionClassifier() {}

    public static ActionCategory classify(PendingAction action) {
        return classify(action.type());
    }

    public static ActionCategory classify(String actionType) {
        String type = actionType == null ? "" : actionType.toLowerCase(Locale.ROOT);
        ActionCategory known = KNOWN_TYPES.get(type);
        if (known != null) {
            return known;
        }
        if (ALWAYS_PAUSE.contains(type)) {
            return ActionCategory.CRITICAL;
        }
        List<String> tokens = tokenize(type);
        for (Map.Entry<ActionCategory, List<String>> rule : KEYWORDS) {
            if (rule.getValue().stream().anyMatch(keyword -> containsTokens(tokens, tokenize(keyword)))) {
                return rule.getKey();
            }
        }
        return ActionCategory.MODERATE;
    }

    static List<String> tokenize(String text) {
        return Arrays.stream(TOKEN_SEPARATOR.split(text))
            .filter(token -> !token.isEmpty())
            .collect(Collectors.toList());
    }

    private static boolean containsTokens(List<String> tokens, List<String> keyword) {
        return !keyword.isEmpty() && Collections.indexOfSubList(tokens, keyword) >= 0;
    }

    public static boolean isAlwaysPause(String actionType) {
        return actionType != null && ALWAYS_PAUSE.contains(actionType.toLowerCase(Locale.ROOT));
    }
}
