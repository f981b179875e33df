package com.rolesync.verifier.reconcile.model;

public record RoleActionResult(ActionError error) {
    private static final RoleActionResult OK = new RoleActionResult(null);

    public static RoleActionResult ok() {
        return OK;
    }

    public static RoleActionResult failed(ActionError error) {
        return new RoleActionResult(error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
