import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

public final class RunContext {
  
  private static final DateTimeFormatter NODASH = DateTimeFormatter.BASIC_ISO_DATE;
  
  private RunContext() {
  }
  
  public static Map<String, String> forDate(LocalDate runDate) {
    Map<String, String> context = new LinkedHashMap<>();
    put(context, "ds", runDate);
    put(context, "yesterday_ds", runDate.minusDays(1));
    put(context, "tomorrow_ds", runDate.plusDays(1));
    return context;
  }
  
  private static void put(Map<String, String> context, String name, LocalDate date) {
    context.put(name, date.toString());
    context.put(name + "_nodash", date.format(NODASH));
  }
}
