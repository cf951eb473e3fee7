/**
 * HTTP surface: the completion endpoint, health, status, Prometheus metrics and admin
 * operations, served by the JDK's {@code com.sun.net.httpserver}.
 */
package fr.lapetina.aimux.api;
