package io.kestra.plugin.adldap;

import com.amazon.ion.IonSystem;
import com.amazon.ion.IonType;
import com.amazon.ion.IonWriter;
import com.amazon.ion.system.IonSystemBuilder;
import io.kestra.core.runners.RunContext;
import io.kestra.plugin.adldap.models.Entry;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Writes directory results as ION files to the Kestra internal storage.
 */
final public class Utils {
    private Utils() {
    }

    /**
     * Stores one ION struct per entry: {@code {dn:"...",type:"USER",attributes:{cn:["..."]}}}.
     * @param raw : Whether the type field is omitted, entries being returned as the server sent them.
     * @return URI of the stored file.
     */
    public static URI storeEntries(RunContext runContext, Collection<Entry> entries, boolean raw) throws IOException {
        IonSystem ionSystem = IonSystemBuilder.standard().build();
        try (ByteArrayOutputStream byteArrayOutputStream = new ByteArrayOutputStream();
             IonWriter ionWriter = ionSystem.newTextWriter(byteArrayOutputStream)) {

            for (Entry entry : entries) {
                writeIonEntry(ionWriter, entry, raw);
            }
            ionWriter.finish();

            return store(runContext, byteArrayOutputStream);
        }
    }

    /**
     * Stores one ION struct per DN: {@code {dn:"..."}}.
     * @return URI of the stored file.
     */
    public static URI storeDns(RunContext runContext, List<String> dns) throws IOException {
        IonSystem ionSystem = IonSystemBuilder.standard().build();
        try (ByteArrayOutputStream byteArrayOutputStream = new ByteArrayOutputStream();
             IonWriter ionWriter = ionSystem.newTextWriter(byteArrayOutputStream)) {

            for (String dn : dns) {
                ionWriter.stepIn(IonType.STRUCT);
                ionWriter.setFieldName("dn");
                ionWriter.writeString(dn);
                ionWriter.stepOut();
            }
            ionWriter.finish();

            return store(runContext, byteArrayOutputStream);
        }
    }

    private static URI store(RunContext runContext, ByteArrayOutputStream content) throws IOException {
        String resultContent = content.toString(StandardCharsets.UTF_8).replace("} {", "}\n{");
        File tempFile = runContext.tempFile(resultContent.getBytes(StandardCharsets.UTF_8), ".ion").toFile();
        return runContext.storage().putFile(tempFile);
    }

    private static void writeIonEntry(IonWriter ionWriter, Entry entry, boolean raw) throws IOException {
        ionWriter.stepIn(IonType.STRUCT);

        ionWriter.setFieldName("dn");
        if (entry.getDn() == null) {
            ionWriter.writeNull();
        } else {
            ionWriter.writeString(entry.getDn());
        }

        if (!raw) {
            ionWriter.setFieldName("type");
            ionWriter.writeString(entry.getType().name());
        }

        ionWriter.setFieldName("attributes");
        writeAttributes(ionWriter, entry.getAttributes());

        ionWriter.stepOut();
    }

    private static void writeAttributes(IonWriter ionWriter, Map<String, List<String>> attributes) throws IOException {
        ionWriter.stepIn(IonType.STRUCT);
        for (Map.Entry<String, List<String>> attribute : attributes.entrySet()) {
            ionWriter.setFieldName(attribute.getKey());
            ionWriter.stepIn(IonType.LIST);

            if (attribute.getValue().isEmpty()) {
                // No value at all -> single null
                ionWriter.writeNull();
            } else {
                for (String value : attribute.getValue()) {
                    ionWriter.writeString(value);
                }
            }

            ionWriter.stepOut();
        }
        ionWriter.stepOut();
    }
}
