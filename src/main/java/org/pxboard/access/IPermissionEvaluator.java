package org.pxboard.access;

/**
 * Decides whether an identity may perform an action.
 */
public interface IPermissionEvaluator {

    /**
     * @param identity   The acting user, or {@code null} for anonymous requests.
     * @param permission The action.
     * @return Whether the action is allowed.
     */
    boolean hasPermission(Identity identity, Permission permission);
}
