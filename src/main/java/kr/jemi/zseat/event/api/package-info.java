@NamedInterface("api")
package kr.jemi.zseat.event.api;

import org.springframework.modulith.NamedInterface;
