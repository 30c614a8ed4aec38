package edu.isi.ccglex;
/** the source never declared a primitive, so there is no start category */
public class NoPrimitivesDeclaredException extends DataFormatException {
    public NoPrimitivesDeclaredException() { 
	super("No primitive categories declared; expected at least one ':-' line"); 
    }
}
