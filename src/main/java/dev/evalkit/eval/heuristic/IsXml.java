package dev.evalkit.eval.heuristic;

import dev.evalkit.eval.EvalContext;
import dev.evalkit.eval.MetricInput;
import dev.evalkit.eval.ScoreResult;
import java.io.StringReader;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;

/** 1.0 if the output is a well-formed XML document. DTDs and external entities are not loaded. */
public final class IsXml extends BaseMetric {

    public IsXml() {
        super("is_xml");
    }

    @Override
    public ScoreResult score(EvalContext ctx, MetricInput input) {
        try {
            var reader = newFactory().createXMLStreamReader(new StringReader(input.output()));
            try {
                while (reader.hasNext()) {
                    reader.next();
                }
            } finally {
                reader.close();
            }
            return pass("valid XML");
        } catch (XMLStreamException e) {
            return fail("invalid XML: " + e.getMessage());
        }
    }

    // factories are not guaranteed to be thread safe
    private static XMLInputFactory newFactory() {
        var factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return factory;
    }
}
