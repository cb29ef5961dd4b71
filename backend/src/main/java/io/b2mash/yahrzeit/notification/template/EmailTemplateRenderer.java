package io.b2mash.yahrzeit.notification.template;

import io.b2mash.yahrzeit.integration.email.RenderedEmail;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

/**
 * Renders HTML emails from Thymeleaf classpath templates under {@code templates/email/}.
 *
 * <p>Rendering uses two passes: the content template is rendered first, then the result is
 * injected into the {@code base} layout as unescaped HTML.
 */
@Service
public class EmailTemplateRenderer {

  private static final Logger log = LoggerFactory.getLogger(EmailTemplateRenderer.class);

  private static final String DEFAULT_SUBJECT = "Yahrzeit reminder";

  private final TemplateEngine emailTemplateEngine;

  public EmailTemplateRenderer() {
    this.emailTemplateEngine = createEmailTemplateEngine();
  }

  /**
   * Renders {@code templateName} inside the base layout.
   *
   * @param templateName template name without path or suffix (e.g., "yahrzeit-reminder")
   * @param context template variables; {@code subject} becomes the email subject
   */
  public RenderedEmail render(String templateName, Map<String, Object> context) {
    var ctx = new Context();
    context.forEach(ctx::setVariable);

    String contentHtml = emailTemplateEngine.process(templateName, ctx);

    ctx.setVariable("contentHtml", contentHtml);
    String fullHtml = emailTemplateEngine.process("base", ctx);

    String plainTextBody = toPlainText(fullHtml);
    Object subject = context.get("subject");

    log.debug("Rendered email template '{}', HTML size={}", templateName, fullHtml.length());

    return new RenderedEmail(
        subject != null ? subject.toString() : DEFAULT_SUBJECT, fullHtml, plainTextBody);
  }

  /** Strips tags for the plain-text part, keeping link targets in parentheses. */
  String toPlainText(String html) {
    if (html == null || html.isBlank()) {
      return "";
    }

    String text = html;

    // <a href="url">text</a> -> text (url)
    text = text.replaceAll("<a[^>]*href=\"([^\"]*)\"[^>]*>([^<]*)</a>", "$2 ($1)");

    text = text.replaceAll("(?is)<head.*?</head>", "");
    text = text.replaceAll("<br\\s*/?>", "\n");
    text = text.replaceAll("</p>", "\n\n");
    text = text.replaceAll("</div>", "\n");
    text = text.replaceAll("</h[1-6]>", "\n\n");
    text = text.replaceAll("</tr>", "\n");
    text = text.replaceAll("</td>", " ");

    text = text.replaceAll("<[^>]+>", "");

    text = text.replace("&amp;", "&");
    text = text.replace("&lt;", "<");
    text = text.replace("&gt;", ">");
    text = text.replace("&quot;", "\"");
    text = text.replace("&nbsp;", " ");
    text = text.replace("&#39;", "'");

    text = text.replaceAll("[ \\t]+", " ");
    text = text.replaceAll("(?m)^ +", "");
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
