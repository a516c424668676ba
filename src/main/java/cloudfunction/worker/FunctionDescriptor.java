package cloudfunction.worker;

import cloudfunction.common.FunctionLoadException;
import cloudfunction.common.Jsons;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Contents of a {@code <function>.function.json} file:
 *
 * <pre>
 * {"class": "com.acme.Echo", "entry": "main", "description": "Returns its input"}
 * </pre>
 */
public record FunctionDescriptor(String name, Path file, String className, String entry, String description) {

    public static final String SUFFIX = ".function.json";
    public static final String DEFAULT_ENTRY = "main";

    public FunctionDescriptor {
        if (entry == null || entry.isBlank()) {
            entry = DEFAULT_ENTRY;
        }
    }

    public static String functionName(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.endsWith(SUFFIX) ? fileName.substring(0, fileName.length() - SUFFIX.length()) : fileName;
    }

    public static FunctionDescriptor read(Path file) {
        String name = functionName(file);
        Document doc;
        try {
            doc = Jsons.mapper().readValue(Files.readAllBytes(file), Document.class);
        } catch (IOException e) {
            throw new FunctionLoadException("Cannot read descriptor " + file + ": " + e.getMessage(), e);
        }
        if (doc.className() == null || doc.className().isBlank()) {
            throw new FunctionLoadException("Descriptor " + file + " has no \"class\"");
        }
        return new FunctionDescriptor(name, file, doc.className(), doc.entry(), doc.description());
    }

    public void write() throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, Jsons.toJson(new Document(className, entry, description)));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record Document(@JsonProperty("class") String className,
                    @JsonProperty("entry") String entry,
                    @JsonProperty("description") String description) {
    }
}
