package io.github.samzhu.relay.exception;

import java.util.Locale;

/**
 * 將上游網路異常歸類為 {@link ErrorCategory}
 *
 * <p>比對對象為整條 cause chain 的類別名稱與訊息（轉小寫後以空白串接），
 * 任何輸入都會得到一個分類，不會拋出異常。
 */
public final class UpstreamErrorClassifier {

    private UpstreamErrorClassifier() {
    }

    public static ErrorCategory classify(Throwable error) {
        String description = describe(error);
        for (ErrorCategory category : ErrorCategory.values()) {
            if (category.matches(description)) {
                return category;
            }
        }
        return ErrorCategory.UNKNOWN;
    }

    static String describe(Throwable error) {
        StringBuilder description = new StringBuilder();
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < 10) {
            description.append(current.getClass().getSimpleName()).append(' ');
            if (current.getMessage() != null) {
                description.append(current.getMessage()).append(' ');
            }
            current = current.getCause();
        }
        return description.toString().toLowerCase(Locale.ROOT);
    }
}
