package com.railwise.backend.controller;

import com.railwise.backend.model.ErrorResponse;
import jakarta.servlet.RequestDispatcher;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.boot.web.servlet.error.ErrorController;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
public class CustomErrorController implements ErrorController {

    @RequestMapping(value = "/error", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ErrorResponse> handleErrorJson(HttpServletRequest request) {
        int statusCode = statusCode(request);
        Object uri = request.getAttribute(RequestDispatcher.ERROR_REQUEST_URI);

        ErrorResponse error = ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(statusCode)
                .error(HttpStatus.valueOf(statusCode).getReasonPhrase())
                .message("The endpoint you are looking for does not exist on Railwise.")
                .path(uri != null ? uri.toString() : null)
                .build();

        return new ResponseEntity<>(error, HttpStatus.valueOf(statusCode));
    }

    @RequestMapping(value = "/error", produces = MediaType.TEXT_HTML_VALUE)
    public String handleErrorHtml(HttpServletRequest request) {
        int code = statusCode(request);

        return "<html>" +
                "<head><title>Railwise - Error</title>" +
                "<style>" +
                "body { font-family: 'Segoe UI', Tahoma, Geneva, Verdana, sans-serif; background-color: #f4f7f5; color: #333; display: flex; align-items: center; justify-content: center; height: 100vh; margin: 0; }"
                +
                ".container { text-align: center; padding: 40px; background: white; border-radius: 12px; box-shadow: 0 4px 20px rgba(0,0,0,0.08); max-width: 500px; }"
                +
                "h1 { color: #006a4e; font-size: 80px; margin: 0; }" +
                "p { font-size: 18px; color: #666; }" +
                "a { display: inline-block; margin-top: 20px; padding: 12px 24px; background-color: #006a4e; color: white; text-decoration: none; border-radius: 6px; font-weight: bold; }"
                +
                "</style>" +
                "</head>" +
                "<body>" +
                "<div class='container'>" +
                "<h1>" + code + "</h1>" +
                "<h2>Wrong platform?</h2>" +
                "<p>This stop is not on the <strong>Railwise</strong> line.</p>" +
                "<a href='swagger-ui.html'>Explore API Docs</a>" +
                "</div>" +
                "</body>" +
                "</html>";
    }

    private static int statusCode(HttpServletRequest request) {
        Object status = request.getAttribute(RequestDispatcher.ERROR_STATUS_CODE);
        return status != null ? Integer.parseInt(status.toString()) : HttpStatus.NOT_FOUND.value();
    }
}
