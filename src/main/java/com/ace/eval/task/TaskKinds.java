package com.ace.eval.task;

import java.util.Locale;

public final class TaskKinds {
    public static final String MCQ = "MCQ";
    public static final String TEXT = "TEXT";
    public static final String AUDIO = "AUDIO";

    private TaskKinds() {
    }

    public static String normalize(String kind) {
        return kind == null ? null : kind.trim().toUpperCase(Locale.ROOT);
    }
}
