package videodigest;

/**
 * Weld scans this package recursively to find the beans in every module, which also works from an uber jar.
 */
public class Marker {
}
