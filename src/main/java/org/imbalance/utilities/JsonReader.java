package org.imbalance.utilities;

import org.imbalance.exceptions.ConfigurationException;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class JsonReader {
    private JsonReader() {}

    private static String readAll(Reader rd) throws IOException {
        StringBuilder sb = new StringBuilder();
        int cp;
        while ((cp = rd.read()) != -1) {
            sb.append((char) cp);
        }
        return sb.toString();
    }

    public static JSONObject load(Path path) {
        try {
            String jsonString = Files.readString(path, StandardCharsets.UTF_8);
            return new JSONObject(jsonString);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + path + ": " + e.getMessage(), e);
        } catch (JSONException e) {
            throw new ConfigurationException("Invalid JSON in " + path + ": " + e.getMessage(), e);
        }
    }

    public static JSONObject loadResource(String resource) {
        InputStream input = JsonReader.class.getClassLoader().getResourceAsStream(resource);
        if (input == null) {
            throw new ConfigurationException("Resource not found on classpath: " + resource);
        }
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            return new JSONObject(readAll(reader));
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read resource " + resource + ": " + e.getMessage(), e);
        } catch (JSONException e) {
            throw new ConfigurationException("Invalid JSON in resource " + resource + ": " + e.getMessage(), e);
        }
    }
}
