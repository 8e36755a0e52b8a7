package io.macroq.stage;

public final class RecordNames {
    public static final String INPUT_DATA = "input-data";
    public static final String RESULT = "result";
    public static final String LOCALIZED = "localized";

    private RecordNames() {
    }

    public static String inputData(long index) {
        return of(INPUT_DATA, index);
    }

    public static String result(long index) {
        return of(RESULT, index);
    }

    public static String localized(long index) {
        return of(LOCALIZED, index);
    }

    private static String of(String role, long index) {
        if (index < 0) {
            throw new IllegalArgumentException("task index must not be negative: " + index);
        }
        return role + "_of_task_" + index;
    }

    public static boolean isValid(String name) {
        if (name == null || name.isBlank() || name.length() > 200) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char ch = name.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= 'A' && ch <= 'Z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            if (!ok) {
                return false;
            }
        }
        return !name.startsWith(".");
    }
}
