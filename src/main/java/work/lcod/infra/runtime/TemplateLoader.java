package work.lcod.infra.runtime;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import work.lcod.infra.ast.TemplateDecl;
import work.lcod.infra.ast.TemplateParser;
import work.lcod.infra.syntax.Diagnostics;
import work.lcod.infra.syntax.YamlSyntaxReader;

/**
 * Loads templates (local path or HTTP URL) into declarations. Template problems go to the
 * diagnostics; unreadable sources throw.
 */
public final class TemplateLoader {
    private TemplateLoader() {}

    public static TemplateDecl loadFromLocalFile(Path path, Diagnostics diags) {
        String text;
        try {
            text = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read template: " + path, ex);
        }
        return parse(path.toString(), text, diags);
    }

    public static TemplateDecl loadFromHttp(URI uri, Diagnostics diags) {
        try {
            var client = HttpClient.newHttpClient();
            var request = HttpRequest.newBuilder(uri).GET().build();
            var response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() >= 400) {
                throw new IllegalStateException("HTTP " + response.statusCode() + " while downloading template: " + uri);
            }
            return parse(uri.getPath() == null ? uri.toString() : uri.getPath(), response.body(), diags);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while downloading template: " + uri, ex);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to download template: " + uri, ex);
        }
    }

    public static TemplateDecl parse(String fileName, String text, Diagnostics diags) {
        var root = YamlSyntaxReader.read(fileName, text);
        return TemplateParser.parse(root, diags);
    }
}
