package io.onschedule.core.notification.template;

import io.onschedule.core.integration.email.RenderedEmail;
import io.onschedule.core.template.EmailTemplate;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.util.HtmlUtils;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders reminder emails locally for providers that cannot use hosted templates. The stored
 * template content is compiled by replacing {@code {{name}}} placeholders, then injected into the
 * {@code reminder-fallback} Thymeleaf layout under templates/email/.
 */
@Service
public class FallbackEmailRenderer {

  private static final Logger log = LoggerFactory.getLogger(FallbackEmailRenderer.class);

  private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*(\\w+)\\s*}}");
  private static final String DEFAULT_SUBJECT = "Inspection Reminder - {{companyName}}";

  private final TemplateEngine emailTemplateEngine;

  public FallbackEmailRenderer() {
    this.emailTemplateEngine = createEmailTemplateEngine();
  }

  public RenderedEmail render(EmailTemplate template, Map<String, Object> variables) {
    String rawSubject =
        template.getSubject() == null || template.getSubject().isBlank()
            ? DEFAULT_SUBJECT
            : template.getSubject();
    String subject = compile(rawSubject, variables, false);

    var ctx = new Context();
    variables.forEach(ctx::setVariable);
    ctx.setVariable("subject", subject);
    if (template.getContent() != null && !template.getContent().isBlank()) {
      ctx.setVariable("contentHtml", compile(template.getContent(), variables, true));
    }
    String fullHtml = emailTemplateEngine.process("reminder-fallback", ctx);

    log.debug(
        "Compiled fallback email from template {}, HTML size={}",
        template.getId(),
        fullHtml.length());
    return new RenderedEmail(subject, fullHtml, toPlainText(fullHtml));
  }

  /**
   * Replaces each {@code {{name}}} with its variable value. Placeholders without a variable are
   * left as they are.
   */
  String compile(String raw, Map<String, Object> variables, boolean escapeHtml) {
    Matcher matcher = PLACEHOLDER.matcher(raw);
    var out = new StringBuilder();
    while (matcher.find()) {
      String name = matcher.group(1);
      String replacement;
      if (variables.containsKey(name)) {
        String value = String.valueOf(variables.get(name));
        replacement = escapeHtml ? HtmlUtils.htmlEscape(value) : value;
      } else {
        replacement = matcher.group(0);
      }
      matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
    }
    matcher.appendTail(out);
    return out.toString();
  }

  /**
   * Strips HTML tags to produce a plain-text alternative body. Preserves link text with URL in
   * parentheses. Collapses whitespace.
   */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }

    String text = html;
    text = text.replaceAll("(?is)<head[^>]*>.*?</head>", "");
    text = text.replaceAll("<a[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>", "$2 ($1)");

    text = text.replaceAll("<br\\s*/?>", "\n");
    text = text.replaceAll("</p>", "\n\n");
    text = text.replaceAll("</div>", "\n");
    text = text.replaceAll("</tr>", "\n");
    text = text.replaceAll("</li>", "\n");
    text = text.replaceAll("</td>", " ");

    text = text.replaceAll("<[^>]+>", "");

    text = text.replace("&amp;", "&");
    text = text.replace("&lt;", "<");
    text = text.replace("&gt;", ">");
    text = text.replace("&quot;", "\"");
    text = text.replace("&nbsp;", " ");
    text = text.replace("&#39;", "'");

    text = text.replaceAll("[ \\t]+", " ");
    text = text.replaceAll("(?m)^ +| +$", "");
    text = text.replaceAll("\\n{3,}", "\n\n");

    return text.strip();
  }

  private static TemplateEngine createEmailTemplateEngine() {
    var engine = new TemplateEngine();

    var resolver = new ClassLoaderTemplateResolver();
    resolver.setPrefix("templates/email/");
    resolver.setSuffix(".html");
    resolver.setTemplateMode(TemplateMode.HTML);
    resolver.setCharacterEncoding("UTF-8");
    resolver.setCacheable(true);

    engine.setTemplateResolver(resolver);
    return engine;
  }
}
