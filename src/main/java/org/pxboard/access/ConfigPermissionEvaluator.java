package org.pxboard.access;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigObject;
import com.typesafe.config.ConfigUtil;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Permission evaluator backed by static lists from configuration.
 * <pre>
 * permissions {
 *   anonymous = ["boards.list", "boards.get"]
 *   authenticated = ["boards.pixels.post"]   # in addition to anonymous
 *   users { "alice" = ["boards.patch"] }      # in addition to authenticated
 * }
 * </pre>
 */
public class ConfigPermissionEvaluator implements IPermissionEvaluator {

    private final Set<Permission> anonymous;
    private final Set<Permission> authenticated;
    private final Map<String, Set<Permission>> users;

    /**
     * @throws IllegalArgumentException if a permission key is unknown.
     */
    public ConfigPermissionEvaluator(final Config options) {
        this.anonymous = parse(options.hasPath("anonymous") ? options.getStringList("anonymous") : List.of());
        this.authenticated = parse(options.hasPath("authenticated") ? options.getStringList("authenticated") : List.of());

        final Map<String, Set<Permission>> perUser = new HashMap<>();
        if (options.hasPath("users")) {
            final ConfigObject usersConfig = options.getObject("users");
            for (final String userId : usersConfig.keySet()) {
                perUser.put(userId, parse(usersConfig.toConfig().getStringList(ConfigUtil.joinPath(userId))));
            }
        }
        this.users = Collections.unmodifiableMap(perUser);
    }

    @Override
    public boolean hasPermission(final Identity identity, final Permission permission) {
        if (anonymous.contains(permission)) {
            return true;
        }
        if (identity == null) {
            return false;
        }
        return authenticated.contains(permission)
            || users.getOrDefault(identity.userId(), Set.of()).contains(permission);
    }

    private static Set<Permission> parse(final List<String> keys) {
        final Set<Permission> permissions = EnumSet.noneOf(Permission.class);
        for (final String key : keys) {
            permissions.add(Permission.fromKey(key)
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission '" + key + "'")));
        }
        return permissions;
    }
}
