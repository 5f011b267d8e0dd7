package com.relayflow.relayflow_engine.executor.github;

import java.util.Arrays;
import java.util.Optional;

public enum GithubAction {
    GET_PULL_REQUEST("get_pull_request"),
    CREATE_ISSUE("create_issue"),
    COMMENT_ISSUE("comment_issue"),
    MERGE_PULL_REQUEST("merge_pull_request"),
    ADD_LABELS("add_labels");

    private final String id;

    GithubAction(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<GithubAction> fromId(String id) {
        return Arrays.stream(values()).filter(a -> a.id.equals(id)).findFirst();
    }

    public static String[] ids() {
        return Arrays.stream(values()).map(GithubAction::id).toArray(String[]::new);
    }
}
