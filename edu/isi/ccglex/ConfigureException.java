package edu.isi.ccglex;
/** for errors in the command line configuration, like missing inputs
    or illegal combinations of options */
public class ConfigureException extends Exception {
    /**      Constructs a new exception with the specified detail message. */
    public ConfigureException(String message) { super(message); }
    /**      Constructs a new exception with the specified detail message and cause.    */
    public ConfigureException(String message, Throwable cause) { super(message, cause); }
}
