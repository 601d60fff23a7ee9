package videodigest.domain.exceptions;

/**
 * Marker interface for internal exceptions. Usually this means a configuration error, invalid inputs,
 * or a request the upstream rejected. These exceptions can not be resolved by retrying.
 */
public interface InternalException {
}
