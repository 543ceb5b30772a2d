package org.example.reporting.utils;

import io.github.cdimascio.dotenv.Dotenv;

/**
 * Liest Geheimnisse und Einstellungen aus der Prozess-Umgebung.
 */
public class ConfigReader {
    private static final Dotenv dotenv = Dotenv.configure()
            .ignoreIfMissing()
            .load();

    /**
     * Prioritaet:
     * 1. System Environment Variable (CI/CD Secret)
     * 2. System Property (z.B. -DBROWSERSTACK_USERNAME=...)
     * 3. .env-Datei (lokale Entwicklung, wird ignoriert wenn nicht vorhanden)
     * 4. Default Wert
     */
    public static String get(String key, String defaultValue) {
        String envValue = System.getenv(key);
        if (envValue != null) return envValue;

        String sysProp = System.getProperty(key);
        if (sysProp != null) return sysProp;

        String dotenvValue = dotenv.get(key, null);
        if (dotenvValue != null) return dotenvValue;

        return defaultValue;
    }
}
