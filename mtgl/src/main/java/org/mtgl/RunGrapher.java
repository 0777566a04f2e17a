package org.mtgl;

import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import org.mtgl.common.tree.TreePrinter;
import org.mtgl.common.util.PropertyUtil;
import org.mtgl.grammar.CatalogException;
import org.mtgl.grammar.GrammarCatalog;
import org.mtgl.tagger.ReferenceTable;

public class RunGrapher {

    private static Logger logger = Logger.getLogger("org.mtgl");

    static final String DEFAULT_PROPERTIES = "mtgl.properties";

    @Option(name="-prop",usage="properties file")
    private File propFile = null;

    @Option(name="-in",usage="card corpus (JSON object keyed by card name)")
    private File inFile = null;

    @Option(name="-out",usage="output file (default stdout)")
    private File outFile = null;

    @Option(name="-name",usage="only graph the card with this name")
    private String cardName = null;

    @Option(name="-threads",usage="number of threads")
    private int threads = -1;

    @Option(name="-attrs",usage="print node attributes")
    private boolean printAttrs = false;

    @Option(name="-tagged",usage="print the tagged text before each tree")
    private boolean printTagged = false;

    @Option(name="-h",usage="help message")
    private boolean help = false;

    public static void main(String[] args) throws Exception
    {
        RunGrapher options = new RunGrapher();
        CmdLineParser parser = new CmdLineParser(options);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException e)
        {
            System.err.println("invalid options:"+e);
            parser.printUsage(System.err);
            System.exit(0);
        }
        if (options.help){
            parser.printUsage(System.err);
            System.exit(0);
        }

        Properties props = PropertyUtil.load(DEFAULT_PROPERTIES, options.propFile);
        Properties runProps = PropertyUtil.filterProperties(props, "mtgl.", true);

        {
            String logLevel = runProps.getProperty("logger.level");
            if (logLevel!=null) {
                ConsoleHandler ch = new ConsoleHandler();
                ch.setLevel(Level.parse(logLevel));
                logger.addHandler(ch);
                logger.setLevel(Level.parse(logLevel));
            }
        }

        logger.info(PropertyUtil.toString(runProps));

        File input = options.inFile;
        if (input==null && runProps.getProperty("input")!=null)
            input = new File(runProps.getProperty("input"));
        if (input==null) {
            System.err.println("no input given");
            parser.printUsage(System.err);
            System.exit(-1);
        }
        File output = options.outFile;
        if (output==null && runProps.getProperty("output")!=null)
            output = new File(runProps.getProperty("output"));
        int threads = options.threads>0?options.threads:PropertyUtil.getInt(runProps, "threads", Runtime.getRuntime().availableProcessors());
        boolean printAttrs = options.printAttrs || PropertyUtil.getBoolean(runProps, "print.attributes", false);
        long timeout = PropertyUtil.getInt(runProps, "timeout.seconds", 0);

        GrammarCatalog catalog;
        try {
            catalog = GrammarCatalog.load();
        } catch (CatalogException e) {
            logger.severe("grammar catalog: "+e.getMessage());
            System.exit(-1);
            return;
        }

        List<Card> cards = new CardReader().read(input);
        ReferenceTable references = Pipeline.references(cards);
        if (options.cardName!=null) {
            List<Card> selected = new ArrayList<Card>();
            for (Card card:cards)
                if (card.getName().equals(options.cardName))
                    selected.add(card);
            if (selected.isEmpty())
                logger.warning("no card named "+options.cardName);
            cards = selected;
        }

        Pipeline pipeline = new Pipeline(catalog, references);
        List<Pipeline.Graphed> results = pipeline.graphAll(cards, threads, timeout);

        int failed = 0;
        try (PrintWriter writer = output==null
                ? new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8))
                : new PrintWriter(new OutputStreamWriter(new FileOutputStream(output), StandardCharsets.UTF_8))) {
            for (Pipeline.Graphed result:results) {
                writer.println(result.getCard().getName());
                if (options.printTagged)
                    for (String tagged:pipeline.tag(result.getCard()))
                        writer.println(tagged);
                if (result.getTree()==null) {
                    ++failed;
                    writer.println("! "+result.getError());
                } else
                    writer.print(TreePrinter.print(result.getTree(), printAttrs));
                writer.println();
            }
            writer.flush();
        } finally {
            references.release();
        }
        logger.info("graphed "+(results.size()-failed)+" of "+results.size()+" cards, "+failed+" failed");
    }
}
