package supportbus.transcript;

/**
 * @param completed conversations ended and removed from the registry
 * @param writes    successful writer calls
 * @param errors    failed writer calls
 */
public record RecorderStats(long completed, long writes, long errors) {
}
