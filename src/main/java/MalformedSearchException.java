public class MalformedSearchException extends RuntimeException {
  
  public MalformedSearchException(String message) {
    super(message);
  }
  
  public MalformedSearchException(String message, Throwable cause) {
    super(message, cause);
  }
}
