package io.github.cyfko.hypermedia.sample;

import io.github.cyfko.hypermedia.core.model.FieldDescriptor;
import io.github.cyfko.hypermedia.core.model.Item;
import io.github.cyfko.hypermedia.core.model.Link;
import io.github.cyfko.hypermedia.core.model.Query;
import io.github.cyfko.hypermedia.core.model.Template;
import io.github.cyfko.hypermedia.core.representation.MarkupRenderer;
import io.github.cyfko.hypermedia.core.representation.RenderModel;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Minimal HTML page for browsers: links, items as tables, queries and templates as forms.
 */
@Component
public class TaskPageRenderer implements MarkupRenderer {

    @Override
    public String render(RenderModel model) {
        StringBuilder html = new StringBuilder("<!DOCTYPE html><html><head><title>")
                .append(escape(model.title()))
                .append("</title></head><body><h1>")
                .append(escape(model.title()))
                .append("</h1>");

        html.append("<nav>");
        for (Link link : model.links()) {
            html.append("<a rel=\"").append(escape(link.rel())).append("\" href=\"").append(escape(link.href())).append("\">")
                    .append(escape(link.prompt() == null ? link.href() : link.prompt())).append("</a> ");
        }
        html.append("</nav>");

        for (Item item : model.items()) {
            html.append("<table data-href=\"").append(escape(item.href())).append("\">");
            for (FieldDescriptor field : item.data()) {
                html.append("<tr><th>").append(escape(field.prompt())).append("</th><td>")
                        .append(escape(String.valueOf(field.value() == null ? "" : field.value()))).append("</td></tr>");
            }
            html.append("</table>");
        }

        for (Query query : model.queries()) {
            html.append("<form method=\"get\" action=\"").append(escape(query.href())).append("\">");
            query.data().forEach(field -> input(html, field));
            html.append("<button>").append(escape(query.prompt())).append("</button></form>");
        }

        for (Template template : model.templates()) {
            html.append("<form method=\"post\" data-method=\"").append(escape(template.method()))
                    .append("\" action=\"").append(escape(template.href())).append("\">");
            template.data().forEach(field -> input(html, field));
            html.append("<button>").append(escape(template.prompt() == null ? template.name() : template.prompt()))
                    .append("</button></form>");
        }
        return html.append("</body></html>").toString();
    }

    private static void input(StringBuilder html, FieldDescriptor field) {
        html.append("<label>").append(escape(field.prompt()));
        if (field.options() != null) {
            html.append("<select name=\"").append(escape(field.name())).append("\">");
            for (String option : field.options()) {
                boolean selected = option.equals(field.value());
                html.append("<option").append(selected ? " selected" : "").append(">").append(escape(option)).append("</option>");
            }
            html.append("</select>");
        } else {
            html.append("<input name=\"").append(escape(field.name())).append("\" type=\"").append(escape(field.inputType()))
                    .append("\" value=\"").append(escape(field.value() == null ? "" : String.valueOf(field.value()))).append("\">");
        }
        html.append("</label>");
    }

    private static String escape(String text) {
        return text == null ? "" : HtmlUtils.htmlEscape(text);
    }
}
