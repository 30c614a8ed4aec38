package edu.isi.ccglex;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.util.Date;
// diagnostics written to stderr. Per-method debug flags call debug(); messages
// the user always sees go through prettyDebug(); timing goes through dbtime()
public class Debug {

    static String encoding = "utf-8";
    public static void setEncoding(String s) {
	encoding = s;
	initializeStream();
    }

    private static Writer w=null;
    private static void initializeStream() {
	try {
	    w = new OutputStreamWriter(System.err, encoding);
	}
	catch (UnsupportedEncodingException e) {
	    System.err.println("Warning: encoding "+encoding+" not supported; using default");
	    w = new OutputStreamWriter(System.err);
	}
    }
    // redirect all diagnostics, e.g. to capture them
    static void setWriter(Writer writer) {
	w = writer;
    }

    private static void write(String s) {
	if (w == null)
	    initializeStream();
	try {
	    w.write(s+"\n");
	    w.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }

    // stuff we always print
    public static void prettyDebug(String s) {
	write(s);
    }
    
    // true debugging stuff. caller is looked up from the stack only when d is on
    public static void debug(boolean d, String s)  {
	if (d)
	    debug(0, caller(), s);
    }
    public static void debug(boolean d, int indent, String s) {
	if (d)
	    debug(indent, caller(), s);
    }
    private static String caller() {
	StackTraceElement e = new Throwable().getStackTrace()[2];
	return e.getClassName()+":"+e.getMethodName();
    }
    private static void debug(int indent, String caller, String s) {   
	StringBuilder sb = new StringBuilder();
	for (int x = 0; x < indent; x++)
	    sb.append(' ');
	sb.append(caller).append(" : ").append(s);
	write(sb.toString());
    }

    private static int dblevel=-1;
    public static void setDbLevel(int i) {
	dblevel = i;
    }
    public static int getDbLevel() {
	return dblevel;
    }
    // print time between pta and ptb if the global level is at least needlevel
    public static void dbtime(int needlevel, Date pta, Date ptb, String msg) {
	if (dblevel < needlevel)
	    return;
	write(msg+": "+(ptb.getTime() - pta.getTime())+" ms");
    }
    // time from pta until now
    public static void dbtime(int needlevel, Date pta, String msg) {
	dbtime(needlevel, pta, new Date(), msg);
    }
}
