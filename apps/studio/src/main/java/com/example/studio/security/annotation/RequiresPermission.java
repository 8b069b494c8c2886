package com.example.studio.security.annotation;

import com.example.studio.permission.Action;
import com.example.studio.scope.model.ScopedResource;

import java.lang.annotation.*;

// Checked against PermissionMatrix before the scope is resolved. Method level wins over type level.
@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface RequiresPermission {

    ScopedResource resource();

    Action action();
}
