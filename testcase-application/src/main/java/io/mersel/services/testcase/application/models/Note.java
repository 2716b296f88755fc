package io.mersel.services.testcase.application.models;

/**
 * TestCase notu.
 *
 * @param text      Not metni
 * @param timestamp ISO-8601 zaman damgası; yoksa {@code null} (yazarken "şimdi" atanır)
 * @param author    Yazar (isteğe bağlı, boş olabilir)
 */
public record Note(String text, String timestamp, String author) {

    public Note {
        text = ModelDefaults.text(text);
        timestamp = ModelDefaults.blankToNull(timestamp);
        author = ModelDefaults.text(author);
    }
}
