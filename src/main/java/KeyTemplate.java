import java.util.Map;

/**
 * Renders object keys such as {@code inferred_users.{ds}.csv.gz} against a run
 * context. Dashes are stripped from the rendered key because the object store
 * paths are partitioned by dash-less dates.
 */
public final class KeyTemplate {
  
  private KeyTemplate() {
  }
  
  public static String render(String template, Map<String, String> context) {
    return stripDashes(substitute(template, context));
  }
  
  static String stripDashes(String key) {
    return key.replace("-", "");
  }
  
  static String substitute(String template, Map<String, String> context) {
    StringBuilder output = new StringBuilder();
    int i = 0;
    while (i < template.length()) {
      char c = template.charAt(i);
      if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '{') {
        output.append('{');
        i += 2;
      } else if (c == '}' && i + 1 < template.length() && template.charAt(i + 1) == '}') {
        output.append('}');
        i += 2;
      } else if (c == '{') {
        int end = template.indexOf('}', i);
        if (end < 0) {
          throw new IllegalArgumentException("Unclosed placeholder in key template: " + template);
        }
        String name = template.substring(i + 1, end);
        String value = context.get(name);
        if (value == null) {
          throw new IllegalArgumentException("Unknown placeholder {" + name + "} in key template: " + template);
        }
        output.append(value);
        i = end + 1;
      } else if (c == '}') {
        throw new IllegalArgumentException("Single '}' in key template: " + template);
      } else {
        output.append(c);
        i++;
      }
    }
    return output.toString();
  }
}
