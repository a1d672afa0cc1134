package ru.oparin.omnihub.service.provider;

import java.time.Duration;

/**
 * Константы адаптеров провайдеров генерации.
 */
public final class ProviderConstants {

    private ProviderConstants() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Константы Fal.ai.
     */
    public static final class FalAi {
        private FalAi() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String AUTH_PREFIX = "Key ";

        /**
         * Параметр запроса, в котором Fal.ai принимает адрес webhook.
         */
        public static final String WEBHOOK_PARAM = "fal_webhook";

        public static final String REQUESTS_PATH = "/requests/";

        public static final String STATUS_SUFFIX = "/status";

        /**
         * Количество сегментов пути, составляющих идентификатор приложения (owner/app).
         * Статус и результат запрашиваются по идентификатору приложения, а не по полному пути модели.
         */
        public static final int APP_ID_SEGMENTS = 2;
    }

    /**
     * Константы Replicate.
     */
    public static final class Replicate {
        private Replicate() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String MODELS_PATH = "/models/";

        public static final String PREDICTIONS_PATH = "/predictions";

        public static final String WEBHOOK_EVENT_COMPLETED = "completed";
    }

    /**
     * Константы OpenRouter.
     */
    public static final class OpenRouter {
        private OpenRouter() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

        /**
         * Маркер завершения SSE-потока OpenAI-совместимого API.
         */
        public static final String DONE_MARKER = "[DONE]";

        public static final Duration FIRST_TOKEN_TIMEOUT = Duration.ofSeconds(120);
    }

    /**
     * Сообщения об ошибках для логов.
     */
    public static final class ErrorMessages {
        private ErrorMessages() {
            throw new UnsupportedOperationException("Utility class");
        }

        public static final String EMPTY_RESULT = "Провайдер %s не вернул ни одного файла результата";
        public static final String NO_JOB_ID = "Провайдер %s не вернул идентификатор задачи";
        public static final String TIMEOUT_MESSAGE = "Превышено время ожидания ответа провайдера %s";
        public static final String CONNECTION_ERROR = "Не удалось подключиться к провайдеру %s: %s";
        public static final String PROVIDER_ERROR_TEMPLATE = "Провайдер %s вернул ошибку. Статус: %s, тело ответа: %s";
        public static final String UNKNOWN_ERROR_TEMPLATE = "Ошибка при работе с провайдером %s: %s";
        public static final String JOB_FAILED_TEMPLATE = "Задача %s у провайдера %s завершилась ошибкой: %s";
        public static final String ADAPTER_NOT_FOUND = "Нет адаптера %s для провайдера %s";
    }
}
