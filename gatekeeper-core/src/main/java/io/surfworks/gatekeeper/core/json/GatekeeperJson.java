package io.surfworks.gatekeeper.core.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.time.Instant;
import java.time.LocalDate;

/**
 * Shared Gson instances for the wire contract and persisted documents.
 *
 * <p>{@link Instant} and {@link LocalDate} are written as ISO-8601 strings.
 */
public final class GatekeeperJson {

    private static final Gson COMPACT = builder().create();
    private static final Gson PRETTY = builder().setPrettyPrinting().create();

    private GatekeeperJson() {}

    /**
     * Compact Gson for wire payloads and database columns.
     */
    public static Gson compact() {
        return COMPACT;
    }

    /**
     * Pretty-printing Gson for files meant to be read by people.
     */
    public static Gson pretty() {
        return PRETTY;
    }

    public static GsonBuilder builder() {
        return new GsonBuilder()
            .disableHtmlEscaping()
            .registerTypeAdapter(Instant.class, new InstantAdapter().nullSafe())
            .registerTypeAdapter(LocalDate.class, new LocalDateAdapter().nullSafe());
    }

    private static final class InstantAdapter extends TypeAdapter<Instant> {
        @Override
        public void write(JsonWriter out, Instant value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public Instant read(JsonReader in) throws IOException {
            return Instant.parse(in.nextString());
        }
    }

    private static final class LocalDateAdapter extends TypeAdapter<LocalDate> {
        @Override
        public void write(JsonWriter out, LocalDate value) throws IOException {
            out.value(value.toString());
        }

        @Override
        public LocalDate read(JsonReader in) throws IOException {
            return LocalDate.parse(in.nextString());
        }
    }
}
