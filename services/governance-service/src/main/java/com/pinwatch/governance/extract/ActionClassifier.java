package com.pinwatch.governance.extract;

import com.pinwatch.governance.config.GovernanceProperties;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Pin-safety and ownership rules for an action reference. Both rules are total.
 */
@Component
public class ActionClassifier {

    private static final Pattern FULL_COMMIT_SHA = Pattern.compile("[0-9a-fA-F]{40}");

    private final Set<String> internalNamespaces;

    @Autowired
    public ActionClassifier(GovernanceProperties properties) {
        this(properties.getInternalNamespaces());
    }

    public ActionClassifier(Collection<String> internalNamespaces) {
        this.internalNamespaces = internalNamespaces == null ? Set.of() : internalNamespaces.stream()
            .filter(ns -> ns != null && !ns.isBlank())
            .map(ns -> ns.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isPinned(String ref) {
        return ref != null && FULL_COMMIT_SHA.matcher(ref).matches();
    }

    public boolean isInternal(String actionId) {
        String owner = ownerOf(actionId);
        return !owner.isEmpty() && internalNamespaces.contains(owner.toLowerCase(Locale.ROOT));
    }

    static String ownerOf(String actionId) {
        if (actionId == null) {
            return "";
        }
        int slash = actionId.indexOf('/');
        return slash < 0 ? actionId.trim() : actionId.substring(0, slash).trim();
    }
}
